package com.example.migrationcompare.exception;

import com.example.migrationcompare.domain.JobErrorCode;

/**
 * Fatal failure of a comparison run. The error code is what ends up on the failed job.
 */
public class ComparisonException extends RuntimeException {
    private final JobErrorCode errorCode;

    public ComparisonException(JobErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ComparisonException(JobErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public JobErrorCode getErrorCode() {
        return errorCode;
    }
}
