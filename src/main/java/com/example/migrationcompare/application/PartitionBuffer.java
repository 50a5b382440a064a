package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.CanonicalRecord;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Canonical records of one side of a job, bucketed by key hash. Records are written by a single
 * reader thread and, after {@link #seal()}, read back one partition at a time in insertion order.
 */
public interface PartitionBuffer extends Closeable {

    void add(CanonicalRecord record) throws IOException;

    /** Ends the write phase. */
    void seal() throws IOException;

    List<CanonicalRecord> read(int partition) throws IOException;

    /** Discards everything written so far, used when a read is retried from the start. */
    void clear() throws IOException;

    long size();

    int partitionCount();
}
