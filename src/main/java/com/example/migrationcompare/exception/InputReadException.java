package com.example.migrationcompare.exception;

import com.example.migrationcompare.domain.JobErrorCode;

public class InputReadException extends ComparisonException {
    public InputReadException(String message, Throwable cause) {
        super(JobErrorCode.IO_FAILURE, message, cause);
    }
}
