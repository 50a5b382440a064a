package com.example.migrationcompare.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One row of the standardized long-format difference report.
 */
public record DifferenceRecord(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("comparison_key") String comparisonKey,
        @JsonProperty("record_id_a") String recordIdA,
        @JsonProperty("record_id_b") String recordIdB,
        @JsonProperty("field_name") String fieldName,
        @JsonProperty("source_value") String sourceValue,
        @JsonProperty("target_value") String targetValue,
        @JsonProperty("difference_type") DifferenceType differenceType,
        @JsonProperty("report_timestamp") Instant reportTimestamp) {

    public static final String SCHEMA_VERSION = "1.0";

    public static final String RECORD_STATUS_FIELD = "__RECORD_STATUS__";
    public static final String PRESENT = "PRESENT";
    public static final String MISSING = "MISSING";
    /** Stands in for a null value on either side of a value mismatch. */
    public static final String NULL_VALUE = "__NULL__";
}
