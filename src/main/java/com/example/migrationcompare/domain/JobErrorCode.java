package com.example.migrationcompare.domain;

/**
 * Stable, classifiable reason stored on a failed job.
 */
public enum JobErrorCode {
    CONFIGURATION,
    DUPLICATE_KEY,
    IO_FAILURE,
    TIMEOUT,
    CANCELLED,
    REJECTED,
    INTERNAL_ERROR
}
