package com.example.migrationcompare.infrastructure;

import com.example.migrationcompare.application.DatasetReader;
import com.example.migrationcompare.domain.DatasetDescriptor;
import com.example.migrationcompare.domain.RawRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads delimited extracts with Commons CSV. The first line of every file is the header. Files of
 * one descriptor are read in declaration order and must share a header.
 *
 * <p>Fields are passed on untouched; trimming and empty-as-null are applied later by the
 * normalizer. A row shorter than the header simply lacks the trailing columns.
 */
@Component
public class CsvDatasetReader implements DatasetReader {
    private static final Logger log = LogManager.getLogger(CsvDatasetReader.class);
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    @Override
    public long read(DatasetDescriptor descriptor, int batchSize, BatchHandler handler)
            throws IOException {
        Charset charset = Charset.forName(descriptor.encoding());
        CSVFormat format =
                CSVFormat.DEFAULT.builder()
                        .setDelimiter(descriptor.delimiter().charAt(0))
                        .setHeader()
                        .setSkipHeaderRecord(true)
                        .setIgnoreEmptyLines(true)
                        .build();
        long rowNumber = 0;
        for (String location : descriptor.locations()) {
            long before = rowNumber;
            rowNumber = readLocation(location, charset, format, batchSize, rowNumber, handler);
            log.debug("Read {} rows from {}", rowNumber - before, location);
        }
        return rowNumber;
    }

    private long readLocation(
            String location,
            Charset charset,
            CSVFormat format,
            int batchSize,
            long rowNumber,
            BatchHandler handler)
            throws IOException {
        try (Reader reader = Files.newBufferedReader(Path.of(location), charset);
                CSVParser parser = format.parse(reader)) {
            List<String> headers = cleanHeaders(parser.getHeaderNames());
            if (headers.isEmpty()) {
                throw new IOException("No header row in " + location);
            }
            List<RawRecord> batch = new ArrayList<>(batchSize);
            for (CSVRecord record : parser) {
                Map<String, String> fields = new HashMap<>();
                for (int i = 0; i < headers.size() && i < record.size(); i++) {
                    fields.put(headers.get(i), record.get(i));
                }
                batch.add(new RawRecord(++rowNumber, location, fields));
                if (batch.size() >= batchSize) {
                    handler.accept(batch);
                    batch = new ArrayList<>(batchSize);
                }
            }
            if (!batch.isEmpty()) {
                handler.accept(batch);
            }
            return rowNumber;
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        } catch (IllegalArgumentException | IllegalStateException ex) {
            throw new IOException("Malformed delimited file " + location + ": " + ex.getMessage(), ex);
        }
    }

    private static List<String> cleanHeaders(List<String> headerNames) {
        List<String> headers = new ArrayList<>(headerNames.size());
        for (int i = 0; i < headerNames.size(); i++) {
            String header = headerNames.get(i);
            if (i == 0 && header.startsWith(BYTE_ORDER_MARK)) {
                header = header.substring(1);
            }
            headers.add(header.strip());
        }
        return headers;
    }
}
