package com.example.migrationcompare.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A record after renaming, type coercion and derivation. Values are {@code String}, {@code Long},
 * {@code BigDecimal}, {@code Boolean} or {@code null}.
 */
public final class CanonicalRecord {
    private final String comparisonKey;
    private final String recordId;
    private final long rowNumber;
    private final Map<String, Object> values;

    public CanonicalRecord(
            String comparisonKey, String recordId, long rowNumber, Map<String, Object> values) {
        this.comparisonKey = Objects.requireNonNull(comparisonKey, "comparisonKey");
        this.recordId = recordId;
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String getComparisonKey() {
        return comparisonKey;
    }

    /** Raw primary-key text as it appeared in the extract, before canonicalization. */
    public String getRecordId() {
        return recordId;
    }

    public long getRowNumber() {
        return rowNumber;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public Object get(String column) {
        return values.get(column);
    }

    @Override
    public String toString() {
        return "CanonicalRecord{key=" + recordId + ", row=" + rowNumber + ", values=" + values + '}';
    }
}
