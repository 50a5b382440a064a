package com.example.migrationcompare.domain;

/**
 * Classification of one long-format difference row. The constant names are part of the output
 * schema and must not change without bumping {@link DifferenceRecord#SCHEMA_VERSION}.
 */
public enum DifferenceType {
    VALUE_MISMATCH,
    MISSING_IN_SOURCE,
    MISSING_IN_TARGET
}
