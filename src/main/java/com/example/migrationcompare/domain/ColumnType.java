package com.example.migrationcompare.domain;

/**
 * Declared type of a canonical column. Columns without an override stay {@link #STRING}.
 */
public enum ColumnType {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN
}
