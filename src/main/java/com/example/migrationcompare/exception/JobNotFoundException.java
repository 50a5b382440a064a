package com.example.migrationcompare.exception;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Comparison job not found: " + jobId);
    }
}
