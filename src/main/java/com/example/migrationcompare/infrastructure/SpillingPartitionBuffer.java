package com.example.migrationcompare.infrastructure;

import com.example.migrationcompare.application.KeyPartitioner;
import com.example.migrationcompare.application.PartitionBuffer;
import com.example.migrationcompare.domain.CanonicalRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Disk-backed buffer for extracts larger than the heap. Each partition is one JSON-lines file
 * under a per-job, per-side directory that is removed on {@link #close()}.
 *
 * <p>Values carry a one-letter type tag ({@code S}, {@code I}, {@code D}, {@code B}) so they read
 * back with the type they were written with.
 */
public class SpillingPartitionBuffer implements PartitionBuffer {
    private final Path directory;
    private final ObjectMapper objectMapper;
    private final BufferedWriter[] writers;
    private long size;

    public SpillingPartitionBuffer(
            Path baseDirectory, String jobId, String side, int partitionCount, ObjectMapper objectMapper)
            throws IOException {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("Partition count must be positive");
        }
        this.directory = Files.createDirectories(baseDirectory.resolve(jobId).resolve(side));
        this.objectMapper = objectMapper;
        this.writers = new BufferedWriter[partitionCount];
    }

    @Override
    public synchronized void add(CanonicalRecord record) throws IOException {
        int partition = KeyPartitioner.partitionOf(record.getComparisonKey(), writers.length);
        BufferedWriter writer = writers[partition];
        if (writer == null) {
            writer = Files.newBufferedWriter(partitionFile(partition), StandardCharsets.UTF_8);
            writers[partition] = writer;
        }
        writer.write(objectMapper.writeValueAsString(toLine(record)));
        writer.newLine();
        size++;
    }

    @Override
    public synchronized void seal() throws IOException {
        closeWriters();
    }

    @Override
    public synchronized List<CanonicalRecord> read(int partition) throws IOException {
        Path file = partitionFile(partition);
        List<CanonicalRecord> records = new ArrayList<>();
        if (!Files.exists(file)) {
            return records;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isEmpty()) {
                    records.add(fromLine(objectMapper.readValue(line, SpilledRecord.class)));
                }
            }
        }
        return records;
    }

    @Override
    public synchronized void clear() throws IOException {
        closeWriters();
        for (int partition = 0; partition < writers.length; partition++) {
            Files.deleteIfExists(partitionFile(partition));
        }
        size = 0;
    }

    @Override
    public synchronized long size() {
        return size;
    }

    @Override
    public int partitionCount() {
        return writers.length;
    }

    @Override
    public synchronized void close() throws IOException {
        clear();
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> stream = Files.walk(directory)) {
            for (Path path : stream.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
        Path jobDirectory = directory.getParent();
        boolean empty;
        try (Stream<Path> remaining = Files.list(jobDirectory)) {
            empty = remaining.findAny().isEmpty();
        }
        if (empty) {
            Files.deleteIfExists(jobDirectory);
        }
    }

    Path getDirectory() {
        return directory;
    }

    private Path partitionFile(int partition) {
        return directory.resolve("partition-" + partition + ".jsonl");
    }

    private void closeWriters() throws IOException {
        IOException failure = null;
        for (int i = 0; i < writers.length; i++) {
            if (writers[i] == null) {
                continue;
            }
            try {
                writers[i].close();
            } catch (IOException ex) {
                failure = ex;
            }
            writers[i] = null;
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static SpilledRecord toLine(CanonicalRecord record) {
        Map<String, String> values = new LinkedHashMap<>();
        record.getValues().forEach((column, value) -> values.put(column, encode(value)));
        return new SpilledRecord(
                record.getComparisonKey(), record.getRecordId(), record.getRowNumber(), values);
    }

    private static CanonicalRecord fromLine(SpilledRecord line) throws IOException {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : line.values().entrySet()) {
            values.put(entry.getKey(), decode(entry.getValue()));
        }
        return new CanonicalRecord(line.key(), line.recordId(), line.row(), values);
    }

    private static String encode(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long number) {
            return "I:" + number;
        }
        if (value instanceof BigDecimal decimal) {
            return "D:" + decimal.toPlainString();
        }
        if (value instanceof Boolean flag) {
            return "B:" + flag;
        }
        return "S:" + value;
    }

    private static Object decode(String encoded) throws IOException {
        if (encoded == null) {
            return null;
        }
        if (encoded.length() < 2 || encoded.charAt(1) != ':') {
            throw new IOException("Corrupt spilled value '" + encoded + "'");
        }
        String body = encoded.substring(2);
        return switch (encoded.charAt(0)) {
            case 'I' -> Long.valueOf(body);
            case 'D' -> new BigDecimal(body);
            case 'B' -> Boolean.valueOf(body);
            case 'S' -> body;
            default -> throw new IOException("Unknown value tag in '" + encoded + "'");
        };
    }

    record SpilledRecord(
            @JsonProperty("k") String key,
            @JsonProperty("id") String recordId,
            @JsonProperty("n") long row,
            @JsonProperty("v") Map<String, String> values) {}
}
