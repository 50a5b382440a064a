package com.example.migrationcompare.exception;

import com.example.migrationcompare.domain.JobErrorCode;

public class ComparisonTimeoutException extends ComparisonException {
    public ComparisonTimeoutException(String message) {
        super(JobErrorCode.TIMEOUT, message);
    }
}
