package com.example.migrationcompare.domain;

import java.time.Instant;

/**
 * Read-only view of a job as exposed to the request-handling layer.
 */
public record ComparisonJob(
        String jobId,
        JobStatus status,
        String sourceDataset,
        String targetDataset,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt,
        JobProgress progress,
        JobError error,
        String resultLocation,
        ComparisonSummary summary,
        String mappingVersion,
        String schemaVersion) {}
