package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.CanonicalRecord;
import com.example.migrationcompare.domain.DatasetDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Explicit cache of normalized datasets keyed by dataset name. Callers acquire a {@link Lease},
 * use its records and close it. Evicting an entry never invalidates records already handed out;
 * the next acquire simply loads again.
 *
 * <p>An entry only serves the exact descriptor it was loaded with. Acquiring a cached name with a
 * different descriptor (other files, mapping, types or derived columns) replaces the entry.
 */
@Component
public class CanonicalDatasetCache {
    private static final Logger log = LogManager.getLogger(CanonicalDatasetCache.class);

    private final Map<String, Entry> entries = new HashMap<>();

    @FunctionalInterface
    public interface Loader {
        List<CanonicalRecord> load() throws IOException;
    }

    public synchronized Lease acquire(DatasetDescriptor descriptor, Loader loader) throws IOException {
        String datasetName = descriptor.name();
        Entry entry = entries.get(datasetName);
        if (entry != null && !entry.descriptor.equals(descriptor)) {
            log.info("Descriptor of dataset '{}' changed, reloading", datasetName);
            entries.remove(datasetName);
            entry = null;
        }
        if (entry == null) {
            long start = System.nanoTime();
            entry = new Entry(descriptor, List.copyOf(loader.load()));
            entries.put(datasetName, entry);
            log.info(
                    "Cached dataset '{}' with {} records in {}s",
                    datasetName, entry.records.size(), (System.nanoTime() - start) / 1_000_000_000.0);
        }
        entry.leases++;
        return new Lease(datasetName, entry);
    }

    /** Drops one dataset. Returns whether it was cached. */
    public synchronized boolean evict(String datasetName) {
        Entry removed = entries.remove(datasetName);
        if (removed != null) {
            log.info("Evicted dataset '{}' ({} open leases)", datasetName, removed.leases);
        }
        return removed != null;
    }

    public synchronized int clear() {
        int count = entries.size();
        entries.clear();
        log.info("Cleared {} cached datasets", count);
        return count;
    }

    public synchronized Set<String> cachedDatasets() {
        return new TreeSet<>(entries.keySet());
    }

    public synchronized int openLeases(String datasetName) {
        Entry entry = entries.get(datasetName);
        return entry == null ? 0 : entry.leases;
    }

    private synchronized void release(Entry entry) {
        if (entry.leases > 0) {
            entry.leases--;
        }
    }

    private static final class Entry {
        private final DatasetDescriptor descriptor;
        private final List<CanonicalRecord> records;
        private int leases;

        private Entry(DatasetDescriptor descriptor, List<CanonicalRecord> records) {
            this.descriptor = descriptor;
            this.records = records;
        }
    }

    public final class Lease implements AutoCloseable {
        private final String datasetName;
        private final Entry entry;
        private boolean released;

        private Lease(String datasetName, Entry entry) {
            this.datasetName = datasetName;
            this.entry = entry;
        }

        public String getDatasetName() {
            return datasetName;
        }

        public List<CanonicalRecord> getRecords() {
            return entry.records;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                release(entry);
            }
        }
    }
}
