package com.example.migrationcompare.exception;

import com.example.migrationcompare.domain.JobErrorCode;

public class ResultWriteException extends ComparisonException {
    public ResultWriteException(String message, Throwable cause) {
        super(JobErrorCode.IO_FAILURE, message, cause);
    }
}
