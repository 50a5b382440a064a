package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.AlignedEntry;
import com.example.migrationcompare.domain.CanonicalRecord;
import com.example.migrationcompare.domain.DuplicateKeyPolicy;
import com.example.migrationcompare.exception.DuplicateKeyException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetAlignerTest {
    private final DatasetAligner aligner = new DatasetAligner();

    @Test
    void producesOneEntryPerKeyInTheUnion() throws Exception {
        PartitionBuffer source = buffer(8, record("1", "a"), record("2", "b"), record("3", "c"));
        PartitionBuffer target = buffer(8, record("2", "b"), record("3", "x"), record("4", "d"));

        List<AlignedEntry> entries = aligner.align(source, target, DuplicateKeyPolicy.FAIL).toList();

        Map<String, Class<?>> kinds =
                entries.stream()
                        .collect(Collectors.toMap(AlignedEntry::comparisonKey, Object::getClass));
        assertThat(kinds)
                .containsOnlyKeys(key("1"), key("2"), key("3"), key("4"))
                .containsEntry(key("1"), AlignedEntry.SourceOnly.class)
                .containsEntry(key("2"), AlignedEntry.Matched.class)
                .containsEntry(key("3"), AlignedEntry.Matched.class)
                .containsEntry(key("4"), AlignedEntry.TargetOnly.class);
    }

    @Test
    void disjointKeySetsYieldOnlySingletons() throws Exception {
        List<CanonicalRecord> sourceRecords = new ArrayList<>();
        List<CanonicalRecord> targetRecords = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            sourceRecords.add(record("S" + i, "v"));
            targetRecords.add(record("T" + i, "v"));
        }

        List<AlignedEntry> entries =
                aligner.align(
                                buffer(16, sourceRecords.toArray(new CanonicalRecord[0])),
                                buffer(16, targetRecords.toArray(new CanonicalRecord[0])),
                                DuplicateKeyPolicy.FAIL)
                        .toList();

        Set<String> keys = new HashSet<>();
        entries.forEach(entry -> keys.add(entry.comparisonKey()));
        assertThat(entries).hasSize(1000).noneMatch(entry -> entry instanceof AlignedEntry.Matched);
        assertThat(keys).hasSize(1000);
    }

    @Test
    void failPolicyRejectsDuplicateKeys() {
        List<CanonicalRecord> source = List.of(record("K3", "first"), record("K3", "second"));

        assertThatThrownBy(() -> aligner.alignPartition(source, List.of(), DuplicateKeyPolicy.FAIL))
                .isInstanceOfSatisfying(
                        DuplicateKeyException.class,
                        ex -> {
                            assertThat(ex.getSide()).isEqualTo(DatasetAligner.SOURCE);
                            assertThat(ex.getRecordId()).isEqualTo("K3");
                            assertThat(ex.getMessage()).contains("K3");
                        });
    }

    @Test
    void keepFirstAndKeepLastCollapseDuplicatesAndCountThem() {
        List<CanonicalRecord> target =
                List.of(record("K", "first"), record("K", "second"), record("K", "third"));

        AlignmentResult first = aligner.alignPartition(List.of(), target, DuplicateKeyPolicy.KEEP_FIRST);
        AlignmentResult last = aligner.alignPartition(List.of(), target, DuplicateKeyPolicy.KEEP_LAST);

        assertThat(first.targetDuplicates()).isEqualTo(2);
        assertThat(first.sourceDuplicates()).isZero();
        assertThat(first.entries()).singleElement()
                .isInstanceOfSatisfying(
                        AlignedEntry.TargetOnly.class,
                        entry -> assertThat(entry.target().get("V")).isEqualTo("first"));
        assertThat(last.entries()).singleElement()
                .isInstanceOfSatisfying(
                        AlignedEntry.TargetOnly.class,
                        entry -> assertThat(entry.target().get("V")).isEqualTo("third"));
    }

    @Test
    void sourceKeysKeepInputOrderWithinAPartition() {
        AlignmentResult result =
                aligner.alignPartition(
                        List.of(record("b", "1"), record("a", "1")),
                        List.of(record("z", "1"), record("a", "1")),
                        DuplicateKeyPolicy.FAIL);

        assertThat(result.entries())
                .extracting(AlignedEntry::comparisonKey)
                .containsExactly(key("b"), key("a"), key("z"));
    }

    @Test
    void rejectsBuffersWithDifferentPartitionCounts() {
        assertThatThrownBy(
                        () -> aligner.align(
                                new InMemoryPartitionBuffer(4),
                                new InMemoryPartitionBuffer(8),
                                DuplicateKeyPolicy.FAIL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static CanonicalRecord record(String id, String value) {
        return new CanonicalRecord(key(id), id, 1, Map.of("ID", id, "V", value));
    }

    static String key(String id) {
        return ComparisonKeys.join(List.of(id));
    }

    private static PartitionBuffer buffer(int partitions, CanonicalRecord... records) throws Exception {
        PartitionBuffer buffer = new InMemoryPartitionBuffer(partitions);
        for (CanonicalRecord record : records) {
            buffer.add(record);
        }
        buffer.seal();
        return buffer;
    }
}
