package com.example.migrationcompare.infrastructure;

import com.example.migrationcompare.domain.DatasetDescriptor;
import com.example.migrationcompare.domain.RawRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvDatasetReaderTest {
    private final CsvDatasetReader reader = new CsvDatasetReader();

    @TempDir Path tempDir;

    @Test
    void readsRowsInBatchesAcrossFiles() throws IOException {
        Path first = write("part1.csv", "ID,NAME,QTY\n1,Alice,10\n2,\"Bob, Jr.\",20\n3,Carol,30\n");
        Path second = write("part2.csv", "ID,NAME,QTY\n4,Dan,40\n");
        List<List<RawRecord>> batches = new ArrayList<>();

        long rows = reader.read(descriptor(",", "UTF-8", first, second), 2, batches::add);

        assertThat(rows).isEqualTo(4);
        assertThat(batches).extracting(List::size).containsExactly(2, 1, 1);
        RawRecord bob = batches.get(0).get(1);
        assertThat(bob.rowNumber()).isEqualTo(2);
        assertThat(bob.get("NAME")).isEqualTo("Bob, Jr.");
        RawRecord dan = batches.get(2).get(0);
        assertThat(dan.rowNumber()).isEqualTo(4);
        assertThat(dan.location()).isEqualTo(second.toString());
    }

    @Test
    void honoursDelimiterEncodingAndByteOrderMark() throws IOException {
        Path file = tempDir.resolve("latin.csv");
        Files.write(file, "ID;CITY\n1;Zürich\n".getBytes(Charset.forName("ISO-8859-1")));
        Path bom = write("bom.csv", "\uFEFFID;CITY\n2; Genève \n");
        List<RawRecord> records = new ArrayList<>();

        reader.read(descriptor(";", "ISO-8859-1", file), 10, records::addAll);
        reader.read(descriptor(";", "UTF-8", bom), 10, records::addAll);

        assertThat(records.get(0).fields()).containsEntry("CITY", "Zürich");
        assertThat(records.get(1).fields()).containsEntry("ID", "2").containsEntry("CITY", " Genève ");
    }

    @Test
    void shortRowsLackTrailingColumnsAndEmptyLinesAreIgnored() throws IOException {
        Path file = write("short.csv", "ID,NAME,QTY\n1,Alice\n\n2,Bob,5\n");
        List<RawRecord> records = new ArrayList<>();

        reader.read(descriptor(",", "UTF-8", file), 10, records::addAll);

        assertThat(records).hasSize(2);
        assertThat(records.get(0).fields()).isEqualTo(Map.of("ID", "1", "NAME", "Alice"));
        assertThat(records.get(0).hasColumn("QTY")).isFalse();
    }

    @Test
    void missingFileIsAnIoFailure() {
        assertThatThrownBy(
                        () -> reader.read(descriptor(",", "UTF-8", tempDir.resolve("absent.csv")), 10, batch -> {}))
                .isInstanceOf(IOException.class);
    }

    @Test
    void emptyFileHasNoHeader() throws IOException {
        Path file = write("empty.csv", "");

        assertThatThrownBy(() -> reader.read(descriptor(",", "UTF-8", file), 10, batch -> {}))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("No header");
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static DatasetDescriptor descriptor(String delimiter, String encoding, Path... files) {
        List<String> locations = new ArrayList<>();
        for (Path file : files) {
            locations.add(file.toString());
        }
        return new DatasetDescriptor(
                "test", locations, delimiter, encoding, Map.of(), List.of("ID"), List.of(), Map.of(), Map.of());
    }
}
