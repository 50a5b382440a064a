package com.example.migrationcompare.infrastructure;

import com.example.migrationcompare.application.ResultStore;
import com.example.migrationcompare.application.ValueCoercion;
import com.example.migrationcompare.domain.DifferenceRecord;
import com.example.migrationcompare.domain.ResultFilter;
import com.example.migrationcompare.domain.ResultPage;
import com.example.migrationcompare.domain.SortKey;
import com.example.migrationcompare.infrastructure.persistence.DifferenceRecordEntity;
import com.example.migrationcompare.infrastructure.persistence.DifferenceRecordRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Result store backed by the {@code DIFFERENCE_RECORDS} table. Each partition is written in its
 * own transaction so a failure later in a run leaves earlier partitions committed.
 */
@Component
public class JpaResultStore implements ResultStore {
    public static final List<SortKey> DEFAULT_ORDER =
            List.of(
                    SortKey.asc("record_id_b"),
                    SortKey.asc("field_name"),
                    SortKey.desc("source_numeric"),
                    SortKey.desc("target_numeric"));

    private static final Map<String, String> SORTABLE_COLUMNS =
            Map.ofEntries(
                    Map.entry("job_id", "jobId"),
                    Map.entry("comparison_key", "comparisonKey"),
                    Map.entry("record_id_a", "recordIdA"),
                    Map.entry("record_id_b", "recordIdB"),
                    Map.entry("field_name", "fieldName"),
                    Map.entry("source_value", "sourceValue"),
                    Map.entry("target_value", "targetValue"),
                    Map.entry("difference_type", "differenceType"),
                    Map.entry("report_timestamp", "reportTimestamp"),
                    Map.entry("source_numeric", "sourceNumeric"),
                    Map.entry("target_numeric", "targetNumeric"));

    private static final int NUMERIC_SCALE = 10;
    private static final BigDecimal NUMERIC_LIMIT = BigDecimal.TEN.pow(38 - NUMERIC_SCALE);

    private final DifferenceRecordRepository repository;

    public JpaResultStore(DifferenceRecordRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void write(String jobId, int partition, List<DifferenceRecord> rows) throws IOException {
        List<DifferenceRecordEntity> entities = new ArrayList<>(rows.size());
        for (DifferenceRecord row : rows) {
            entities.add(toEntity(jobId, partition, row));
        }
        try {
            repository.saveAll(entities);
        } catch (DataAccessException ex) {
            throw new IOException("Failed to store partition " + partition, ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public ResultPage query(
            String jobId, List<SortKey> sortKeys, ResultFilter filter, int page, int pageSize) {
        ResultFilter effectiveFilter = filter == null ? ResultFilter.NONE : filter;
        Pageable pageable = PageRequest.of(page, pageSize, toSort(sortKeys));
        Page<DifferenceRecordEntity> result =
                repository.search(
                        jobId, effectiveFilter.differenceType(), effectiveFilter.fieldName(), pageable);
        return new ResultPage(
                result.getContent().stream().map(JpaResultStore::toRecord).toList(),
                page,
                pageSize,
                result.getTotalElements());
    }

    @Override
    @Transactional(readOnly = true)
    public long count(String jobId) {
        return repository.countByJobId(jobId);
    }

    @Override
    @Transactional
    public void deleteByJob(String jobId) {
        repository.deleteByJobId(jobId);
    }

    @Override
    public String locationOf(String jobId) {
        return "/api/jobs/" + jobId + "/results";
    }

    /**
     * Maps output column names to entity properties. The row id always closes the order so that
     * rows with equal sort values keep their arrival order across pages.
     */
    static Sort toSort(List<SortKey> sortKeys) {
        List<SortKey> keys = sortKeys == null || sortKeys.isEmpty() ? DEFAULT_ORDER : sortKeys;
        List<Sort.Order> orders = new ArrayList<>(keys.size() + 1);
        for (SortKey key : keys) {
            String property = SORTABLE_COLUMNS.get(key.column());
            if (property == null) {
                throw new IllegalArgumentException("Cannot sort by unknown column '" + key.column() + "'");
            }
            Sort.Order order =
                    key.direction() == SortKey.Direction.DESC
                            ? Sort.Order.desc(property)
                            : Sort.Order.asc(property);
            orders.add(order.nullsLast());
        }
        orders.add(Sort.Order.asc("id"));
        return Sort.by(orders);
    }

    private static DifferenceRecordEntity toEntity(String jobId, int partition, DifferenceRecord row) {
        DifferenceRecordEntity entity = new DifferenceRecordEntity();
        entity.setJobId(jobId);
        entity.setPartition(partition);
        entity.setComparisonKey(row.comparisonKey());
        entity.setRecordIdA(row.recordIdA());
        entity.setRecordIdB(row.recordIdB());
        entity.setFieldName(row.fieldName());
        entity.setSourceValue(row.sourceValue());
        entity.setTargetValue(row.targetValue());
        entity.setDifferenceType(row.differenceType());
        entity.setReportTimestamp(row.reportTimestamp());
        entity.setSourceNumeric(numericShadow(row.sourceValue()));
        entity.setTargetNumeric(numericShadow(row.targetValue()));
        return entity;
    }

    private static DifferenceRecord toRecord(DifferenceRecordEntity entity) {
        return new DifferenceRecord(
                entity.getJobId(),
                entity.getComparisonKey(),
                entity.getRecordIdA(),
                entity.getRecordIdB(),
                entity.getFieldName(),
                entity.getSourceValue(),
                entity.getTargetValue(),
                entity.getDifferenceType(),
                entity.getReportTimestamp());
    }

    static BigDecimal numericShadow(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        BigDecimal parsed;
        try {
            parsed = ValueCoercion.parseDecimal(value);
        } catch (IllegalArgumentException ex) {
            return null;
        }
        if (parsed.abs().compareTo(NUMERIC_LIMIT) >= 0) {
            return null;
        }
        return parsed.setScale(NUMERIC_SCALE, RoundingMode.HALF_UP);
    }
}
