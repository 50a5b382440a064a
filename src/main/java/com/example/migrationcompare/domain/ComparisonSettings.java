package com.example.migrationcompare.domain;

import java.math.BigDecimal;

/**
 * Per-job comparison rules. The numeric tolerance has no default: a submission without one is
 * rejected because migrated amounts routinely carry rounding noise and the acceptable noise is a
 * business decision.
 */
public record ComparisonSettings(
        BigDecimal numericTolerance,
        ToleranceMode toleranceMode,
        DuplicateKeyPolicy duplicateKeyPolicy,
        Boolean treatEmptyAsNull,
        Boolean trimStrings,
        Boolean ignoreCase) {

    public ComparisonSettings {
        toleranceMode = toleranceMode == null ? ToleranceMode.ABSOLUTE : toleranceMode;
        duplicateKeyPolicy = duplicateKeyPolicy == null ? DuplicateKeyPolicy.FAIL : duplicateKeyPolicy;
        treatEmptyAsNull = treatEmptyAsNull == null ? Boolean.TRUE : treatEmptyAsNull;
        trimStrings = trimStrings == null ? Boolean.TRUE : trimStrings;
        ignoreCase = ignoreCase == null ? Boolean.FALSE : ignoreCase;
    }

    public static ComparisonSettings withTolerance(BigDecimal tolerance) {
        return new ComparisonSettings(tolerance, null, null, null, null, null);
    }

    public ComparisonSettings withDuplicateKeyPolicy(DuplicateKeyPolicy policy) {
        return new ComparisonSettings(
                numericTolerance, toleranceMode, policy, treatEmptyAsNull, trimStrings, ignoreCase);
    }

    public ComparisonSettings withToleranceMode(ToleranceMode mode) {
        return new ComparisonSettings(
                numericTolerance, mode, duplicateKeyPolicy, treatEmptyAsNull, trimStrings, ignoreCase);
    }
}
