package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.DatasetDescriptor;
import com.example.migrationcompare.domain.RawRecord;

import java.io.IOException;
import java.util.List;

/**
 * Reads the delimited files of a descriptor and hands raw rows over in bounded batches.
 */
public interface DatasetReader {

    /**
     * @return number of data rows read across all locations
     */
    long read(DatasetDescriptor descriptor, int batchSize, BatchHandler handler) throws IOException;

    @FunctionalInterface
    interface BatchHandler {
        void accept(List<RawRecord> batch) throws IOException;
    }
}
