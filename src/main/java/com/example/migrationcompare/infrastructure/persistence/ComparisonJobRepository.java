package com.example.migrationcompare.infrastructure.persistence;

import com.example.migrationcompare.domain.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ComparisonJobRepository extends JpaRepository<ComparisonJobEntity, String> {

    @Query(
            "select j from ComparisonJobEntity j"
                    + " where (:dataset is null or j.sourceDataset = :dataset or j.targetDataset = :dataset)"
                    + " and (:status is null or j.status = :status)"
                    + " order by j.createdAt desc")
    List<ComparisonJobEntity> search(
            @Param("dataset") String dataset, @Param("status") JobStatus status);
}
