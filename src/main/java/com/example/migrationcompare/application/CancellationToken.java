package com.example.migrationcompare.application;

import com.example.migrationcompare.exception.CancellationRequestedException;

/**
 * Cooperative cancellation flag shared between the job manager and a running comparison.
 */
public class CancellationToken {
    private final String jobId;
    private volatile boolean cancelled;

    public CancellationToken(String jobId) {
        this.jobId = jobId;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /** Throws if cancellation was requested. Called at batch and partition boundaries. */
    public void checkpoint() {
        if (cancelled) {
            throw new CancellationRequestedException(jobId);
        }
    }
}
