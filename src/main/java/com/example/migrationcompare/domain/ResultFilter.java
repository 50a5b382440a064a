package com.example.migrationcompare.domain;

/**
 * Optional narrowing of a result query; {@code null} fields match everything.
 */
public record ResultFilter(DifferenceType differenceType, String fieldName) {
    public static final ResultFilter NONE = new ResultFilter(null, null);
}
