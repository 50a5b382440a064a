package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.CanonicalRecord;
import com.example.migrationcompare.domain.ComparisonSettings;
import com.example.migrationcompare.domain.DatasetDescriptor;
import com.example.migrationcompare.exception.NormalizationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Pages over the normalized records of a single dataset. Normalized datasets are kept in the
 * {@link CanonicalDatasetCache} under the descriptor name until evicted.
 */
@Service
public class DatasetBrowseService {
    private static final Logger log = LogManager.getLogger(DatasetBrowseService.class);
    private static final int DEFAULT_PAGE_SIZE = 20;

    private final DatasetReader datasetReader;
    private final DescriptorValidator validator;
    private final CanonicalDatasetCache cache;
    private final int readBatchSize;
    private final int maxPageSize;

    public DatasetBrowseService(
            DatasetReader datasetReader,
            DescriptorValidator validator,
            CanonicalDatasetCache cache,
            @Value("${comparison.engine.read-batch-size:10000}") int readBatchSize,
            @Value("${comparison.results.max-page-size:100}") int maxPageSize) {
        this.datasetReader = datasetReader;
        this.validator = validator;
        this.cache = cache;
        this.readBatchSize = Math.max(1, readBatchSize);
        this.maxPageSize = Math.max(1, maxPageSize);
    }

    public RecordPage browse(DatasetDescriptor descriptor, int page, int size) throws IOException {
        CompiledDescriptor compiled = validator.validate(descriptor);
        int safePage = Math.max(page, 0);
        int safeSize = size <= 0 ? Math.min(DEFAULT_PAGE_SIZE, maxPageSize) : Math.min(size, maxPageSize);
        try (CanonicalDatasetCache.Lease lease = cache.acquire(compiled.descriptor(), () -> load(compiled))) {
            List<CanonicalRecord> records = lease.getRecords();
            long offset = (long) safePage * safeSize;
            List<CanonicalRecord> slice =
                    offset >= records.size()
                            ? List.of()
                            : records.subList((int) offset, (int) Math.min(records.size(), offset + safeSize));
            return new RecordPage(slice, safePage, safeSize, records.size());
        }
    }

    public boolean evict(String datasetName) {
        return cache.evict(datasetName);
    }

    public int evictAll() {
        return cache.clear();
    }

    private List<CanonicalRecord> load(CompiledDescriptor descriptor) throws IOException {
        RecordNormalizer normalizer = new RecordNormalizer(ComparisonSettings.withTolerance(BigDecimal.ZERO));
        List<CanonicalRecord> records = new ArrayList<>();
        long[] skipped = new long[1];
        datasetReader.read(
                descriptor.descriptor(),
                readBatchSize,
                batch -> {
                    for (var raw : batch) {
                        try {
                            records.add(normalizer.normalize(raw, descriptor));
                        } catch (NormalizationException ex) {
                            skipped[0]++;
                            log.debug("Skipping row while browsing '{}': {}", descriptor.name(), ex.getMessage());
                        }
                    }
                });
        if (skipped[0] > 0) {
            log.info("Dataset '{}' loaded with {} rows skipped", descriptor.name(), skipped[0]);
        }
        return records;
    }

    public record RecordPage(List<CanonicalRecord> records, int page, int pageSize, long totalCount) {
        public RecordPage {
            records = List.copyOf(records);
        }
    }
}
