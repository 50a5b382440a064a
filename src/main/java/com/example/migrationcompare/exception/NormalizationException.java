package com.example.migrationcompare.exception;

/**
 * A single record could not be canonicalized. Never fatal: the record is skipped and counted.
 */
public class NormalizationException extends Exception {
    public enum Kind {
        MISSING_REQUIRED_COLUMN,
        TYPE_COERCION_FAILURE
    }

    private final Kind kind;
    private final String column;

    public NormalizationException(Kind kind, String column, String message) {
        super(message);
        this.kind = kind;
        this.column = column;
    }

    public Kind getKind() {
        return kind;
    }

    public String getColumn() {
        return column;
    }
}
