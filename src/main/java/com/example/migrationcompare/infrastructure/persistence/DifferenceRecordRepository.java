package com.example.migrationcompare.infrastructure.persistence;

import com.example.migrationcompare.domain.DifferenceType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DifferenceRecordRepository extends JpaRepository<DifferenceRecordEntity, Long> {

    @Query(
            value =
                    "select d from DifferenceRecordEntity d where d.jobId = :jobId"
                            + " and (:type is null or d.differenceType = :type)"
                            + " and (:field is null or d.fieldName = :field)",
            countQuery =
                    "select count(d) from DifferenceRecordEntity d where d.jobId = :jobId"
                            + " and (:type is null or d.differenceType = :type)"
                            + " and (:field is null or d.fieldName = :field)")
    Page<DifferenceRecordEntity> search(
            @Param("jobId") String jobId,
            @Param("type") DifferenceType type,
            @Param("field") String field,
            Pageable pageable);

    long countByJobId(String jobId);

    @Modifying
    @Query("delete from DifferenceRecordEntity d where d.jobId = :jobId")
    int deleteByJobId(@Param("jobId") String jobId);
}
