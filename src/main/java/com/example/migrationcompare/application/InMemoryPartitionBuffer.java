package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.CanonicalRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Heap-backed buffer for extracts that fit in memory.
 */
public class InMemoryPartitionBuffer implements PartitionBuffer {
    private final List<List<CanonicalRecord>> partitions;
    private long size;

    public InMemoryPartitionBuffer(int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("Partition count must be positive");
        }
        this.partitions = new ArrayList<>(partitionCount);
        for (int i = 0; i < partitionCount; i++) {
            partitions.add(new ArrayList<>());
        }
    }

    @Override
    public synchronized void add(CanonicalRecord record) {
        partitions.get(KeyPartitioner.partitionOf(record.getComparisonKey(), partitions.size()))
                .add(record);
        size++;
    }

    @Override
    public void seal() {}

    @Override
    public synchronized List<CanonicalRecord> read(int partition) {
        return List.copyOf(partitions.get(partition));
    }

    @Override
    public synchronized void clear() {
        partitions.forEach(List::clear);
        size = 0;
    }

    @Override
    public synchronized long size() {
        return size;
    }

    @Override
    public int partitionCount() {
        return partitions.size();
    }

    @Override
    public void close() {
        clear();
    }
}
