package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.AlignedEntry;
import com.example.migrationcompare.domain.CanonicalRecord;
import com.example.migrationcompare.domain.DuplicateKeyPolicy;
import com.example.migrationcompare.exception.DuplicateKeyException;
import com.example.migrationcompare.exception.InputReadException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Full outer join of two canonical record sets on the comparison key.
 *
 * <p>Joining happens one hash partition at a time, so only records that share a bucket are ever
 * held in memory together. Within a partition source keys come first in input order, followed by
 * keys only the target has. No order across partitions is promised.
 */
@Component
public class DatasetAligner {
    public static final String SOURCE = "source";
    public static final String TARGET = "target";

    /**
     * Lazily aligns two partitioned sides. Partitions are read only as the stream is consumed.
     */
    public Stream<AlignedEntry> align(
            PartitionBuffer source, PartitionBuffer target, DuplicateKeyPolicy policy) {
        if (source.partitionCount() != target.partitionCount()) {
            throw new IllegalArgumentException("Both sides must use the same partition count");
        }
        return IntStream.range(0, source.partitionCount())
                .mapToObj(partition -> alignPartition(source, target, partition, policy))
                .flatMap(result -> result.entries().stream());
    }

    public AlignmentResult alignPartition(
            PartitionBuffer source, PartitionBuffer target, int partition, DuplicateKeyPolicy policy) {
        List<CanonicalRecord> sourceRecords;
        List<CanonicalRecord> targetRecords;
        try {
            sourceRecords = source.read(partition);
            targetRecords = target.read(partition);
        } catch (IOException ex) {
            throw new InputReadException("Failed to read partition " + partition, ex);
        }
        return alignPartition(sourceRecords, targetRecords, policy);
    }

    /**
     * Aligns two record sets that are already known to share a partition, or that are small
     * enough to be aligned in one go.
     */
    public AlignmentResult alignPartition(
            Iterable<CanonicalRecord> source,
            Iterable<CanonicalRecord> target,
            DuplicateKeyPolicy policy) {
        Map<String, CanonicalRecord> sourceByKey = new LinkedHashMap<>();
        long sourceDuplicates = index(source, sourceByKey, policy, SOURCE);
        Map<String, CanonicalRecord> targetByKey = new LinkedHashMap<>();
        long targetDuplicates = index(target, targetByKey, policy, TARGET);

        List<AlignedEntry> entries = new ArrayList<>(Math.max(sourceByKey.size(), targetByKey.size()));
        for (Map.Entry<String, CanonicalRecord> entry : sourceByKey.entrySet()) {
            CanonicalRecord match = targetByKey.remove(entry.getKey());
            if (match == null) {
                entries.add(new AlignedEntry.SourceOnly(entry.getValue()));
            } else {
                entries.add(new AlignedEntry.Matched(entry.getValue(), match));
            }
        }
        for (CanonicalRecord remaining : targetByKey.values()) {
            entries.add(new AlignedEntry.TargetOnly(remaining));
        }
        return new AlignmentResult(entries, sourceDuplicates, targetDuplicates);
    }

    private long index(
            Iterable<CanonicalRecord> records,
            Map<String, CanonicalRecord> byKey,
            DuplicateKeyPolicy policy,
            String side) {
        long duplicates = 0;
        Iterator<CanonicalRecord> iterator = records.iterator();
        while (iterator.hasNext()) {
            CanonicalRecord record = iterator.next();
            CanonicalRecord previous = byKey.get(record.getComparisonKey());
            if (previous == null) {
                byKey.put(record.getComparisonKey(), record);
                continue;
            }
            switch (policy) {
                case FAIL -> throw new DuplicateKeyException(
                        side, record.getComparisonKey(), record.getRecordId());
                case KEEP_FIRST -> duplicates++;
                case KEEP_LAST -> {
                    byKey.put(record.getComparisonKey(), record);
                    duplicates++;
                }
            }
        }
        return duplicates;
    }
}
