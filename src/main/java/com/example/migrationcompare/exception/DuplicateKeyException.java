package com.example.migrationcompare.exception;

import com.example.migrationcompare.domain.JobErrorCode;

public class DuplicateKeyException extends ComparisonException {
    private final String side;
    private final String comparisonKey;
    private final String recordId;

    public DuplicateKeyException(String side, String comparisonKey, String recordId) {
        super(
                JobErrorCode.DUPLICATE_KEY,
                String.format("Duplicate key '%s' in %s dataset", recordId, side));
        this.side = side;
        this.comparisonKey = comparisonKey;
        this.recordId = recordId;
    }

    public String getSide() {
        return side;
    }

    public String getComparisonKey() {
        return comparisonKey;
    }

    /** Raw key text of the offending record. */
    public String getRecordId() {
        return recordId;
    }
}
