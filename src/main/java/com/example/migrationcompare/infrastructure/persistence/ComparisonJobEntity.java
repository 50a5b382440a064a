package com.example.migrationcompare.infrastructure.persistence;

import com.example.migrationcompare.domain.JobErrorCode;
import com.example.migrationcompare.domain.JobStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(
        name = "COMPARISON_JOBS",
        indexes = {
            @Index(name = "IDX_JOBS_STATUS", columnList = "STATUS"),
            @Index(name = "IDX_JOBS_SOURCE", columnList = "SOURCE_DATASET"),
            @Index(name = "IDX_JOBS_TARGET", columnList = "TARGET_DATASET")
        })
public class ComparisonJobEntity {

    @Id
    @Column(name = "JOB_ID", length = 36)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "STATUS", nullable = false, length = 16)
    private JobStatus status;

    @Column(name = "SOURCE_DATASET", nullable = false)
    private String sourceDataset;

    @Column(name = "TARGET_DATASET", nullable = false)
    private String targetDataset;

    @Column(name = "CREATED_AT", nullable = false)
    private Instant createdAt;

    @Column(name = "UPDATED_AT", nullable = false)
    private Instant updatedAt;

    @Column(name = "STARTED_AT")
    private Instant startedAt;

    @Column(name = "COMPLETED_AT")
    private Instant completedAt;

    @Column(name = "KEYS_PROCESSED", nullable = false)
    private long keysProcessed;

    @Column(name = "TOTAL_KEYS")
    private Long totalKeys;

    @Column(name = "PROGRESS_PERCENT", nullable = false)
    private double progressPercent;

    @Column(name = "PROGRESS_MESSAGE")
    private String progressMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "ERROR_CODE", length = 32)
    private JobErrorCode errorCode;

    @Column(name = "ERROR_DETAIL", length = 4000)
    private String errorDetail;

    @Column(name = "RESULT_LOCATION")
    private String resultLocation;

    @Lob
    @Column(name = "SUMMARY")
    private String summaryJson;

    @Lob
    @Column(name = "REQUEST", nullable = false)
    private String requestJson;

    @Column(name = "MAPPING_VERSION")
    private String mappingVersion;

    @Column(name = "SCHEMA_VERSION", nullable = false, length = 16)
    private String schemaVersion;

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getSourceDataset() {
        return sourceDataset;
    }

    public void setSourceDataset(String sourceDataset) {
        this.sourceDataset = sourceDataset;
    }

    public String getTargetDataset() {
        return targetDataset;
    }

    public void setTargetDataset(String targetDataset) {
        this.targetDataset = targetDataset;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public long getKeysProcessed() {
        return keysProcessed;
    }

    public void setKeysProcessed(long keysProcessed) {
        this.keysProcessed = keysProcessed;
    }

    public Long getTotalKeys() {
        return totalKeys;
    }

    public void setTotalKeys(Long totalKeys) {
        this.totalKeys = totalKeys;
    }

    public double getProgressPercent() {
        return progressPercent;
    }

    public void setProgressPercent(double progressPercent) {
        this.progressPercent = progressPercent;
    }

    public String getProgressMessage() {
        return progressMessage;
    }

    public void setProgressMessage(String progressMessage) {
        this.progressMessage = progressMessage;
    }

    public JobErrorCode getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(JobErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public void setErrorDetail(String errorDetail) {
        this.errorDetail = errorDetail;
    }

    public String getResultLocation() {
        return resultLocation;
    }

    public void setResultLocation(String resultLocation) {
        this.resultLocation = resultLocation;
    }

    public String getSummaryJson() {
        return summaryJson;
    }

    public void setSummaryJson(String summaryJson) {
        this.summaryJson = summaryJson;
    }

    public String getRequestJson() {
        return requestJson;
    }

    public void setRequestJson(String requestJson) {
        this.requestJson = requestJson;
    }

    public String getMappingVersion() {
        return mappingVersion;
    }

    public void setMappingVersion(String mappingVersion) {
        this.mappingVersion = mappingVersion;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }
}
