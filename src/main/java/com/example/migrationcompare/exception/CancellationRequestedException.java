package com.example.migrationcompare.exception;

import com.example.migrationcompare.domain.JobErrorCode;

public class CancellationRequestedException extends ComparisonException {
    public CancellationRequestedException(String jobId) {
        super(JobErrorCode.CANCELLED, "Job " + jobId + " was cancelled");
    }
}
