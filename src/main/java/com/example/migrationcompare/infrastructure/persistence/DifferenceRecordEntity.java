package com.example.migrationcompare.infrastructure.persistence;

import com.example.migrationcompare.domain.DifferenceType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Stored long-format row. {@code SOURCE_NUMERIC} and {@code TARGET_NUMERIC} shadow the text
 * values when they parse as numbers so amount orderings can be served from an index.
 */
@Entity
@Table(
        name = "DIFFERENCE_RECORDS",
        indexes = {
            @Index(name = "IDX_DIFF_JOB_KEY", columnList = "JOB_ID, COMPARISON_KEY, FIELD_NAME"),
            @Index(
                    name = "IDX_DIFF_JOB_REPORT_ORDER",
                    columnList = "JOB_ID, RECORD_ID_B, FIELD_NAME, SOURCE_NUMERIC, TARGET_NUMERIC"),
            @Index(name = "IDX_DIFF_JOB_TYPE", columnList = "JOB_ID, DIFFERENCE_TYPE")
        })
public class DifferenceRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "difference_record_sequence")
    @SequenceGenerator(
            name = "difference_record_sequence",
            sequenceName = "DIFFERENCE_RECORD_SEQ",
            allocationSize = 50)
    private Long id;

    @Column(name = "JOB_ID", nullable = false, length = 36)
    private String jobId;

    @Column(name = "PARTITION_NO", nullable = false)
    private int partition;

    @Column(name = "COMPARISON_KEY", nullable = false, length = 1000)
    private String comparisonKey;

    @Column(name = "RECORD_ID_A", length = 1000)
    private String recordIdA;

    @Column(name = "RECORD_ID_B", length = 1000)
    private String recordIdB;

    @Column(name = "FIELD_NAME", nullable = false)
    private String fieldName;

    @Column(name = "SOURCE_VALUE", length = 4000)
    private String sourceValue;

    @Column(name = "TARGET_VALUE", length = 4000)
    private String targetValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "DIFFERENCE_TYPE", nullable = false, length = 32)
    private DifferenceType differenceType;

    @Column(name = "REPORT_TIMESTAMP", nullable = false)
    private Instant reportTimestamp;

    @Column(name = "SOURCE_NUMERIC", precision = 38, scale = 10)
    private BigDecimal sourceNumeric;

    @Column(name = "TARGET_NUMERIC", precision = 38, scale = 10)
    private BigDecimal targetNumeric;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public int getPartition() {
        return partition;
    }

    public void setPartition(int partition) {
        this.partition = partition;
    }

    public String getComparisonKey() {
        return comparisonKey;
    }

    public void setComparisonKey(String comparisonKey) {
        this.comparisonKey = comparisonKey;
    }

    public String getRecordIdA() {
        return recordIdA;
    }

    public void setRecordIdA(String recordIdA) {
        this.recordIdA = recordIdA;
    }

    public String getRecordIdB() {
        return recordIdB;
    }

    public void setRecordIdB(String recordIdB) {
        this.recordIdB = recordIdB;
    }

    public String getFieldName() {
        return fieldName;
    }

    public void setFieldName(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getSourceValue() {
        return sourceValue;
    }

    public void setSourceValue(String sourceValue) {
        this.sourceValue = sourceValue;
    }

    public String getTargetValue() {
        return targetValue;
    }

    public void setTargetValue(String targetValue) {
        this.targetValue = targetValue;
    }

    public DifferenceType getDifferenceType() {
        return differenceType;
    }

    public void setDifferenceType(DifferenceType differenceType) {
        this.differenceType = differenceType;
    }

    public Instant getReportTimestamp() {
        return reportTimestamp;
    }

    public void setReportTimestamp(Instant reportTimestamp) {
        this.reportTimestamp = reportTimestamp;
    }

    public BigDecimal getSourceNumeric() {
        return sourceNumeric;
    }

    public void setSourceNumeric(BigDecimal sourceNumeric) {
        this.sourceNumeric = sourceNumeric;
    }

    public BigDecimal getTargetNumeric() {
        return targetNumeric;
    }

    public void setTargetNumeric(BigDecimal targetNumeric) {
        this.targetNumeric = targetNumeric;
    }
}
