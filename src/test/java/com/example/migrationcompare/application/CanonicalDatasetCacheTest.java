package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.CanonicalRecord;
import com.example.migrationcompare.domain.DatasetDescriptor;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CanonicalDatasetCacheTest {
    private final CanonicalDatasetCache cache = new CanonicalDatasetCache();
    private final AtomicInteger loads = new AtomicInteger();

    @Test
    void loadsOnceAndCountsLeases() throws IOException {
        try (CanonicalDatasetCache.Lease first = cache.acquire(TestDescriptors.accounts("accounts"), this::load);
                CanonicalDatasetCache.Lease second = cache.acquire(TestDescriptors.accounts("accounts"), this::load)) {
            assertThat(first.getRecords()).hasSize(1).isSameAs(second.getRecords());
            assertThat(cache.openLeases("accounts")).isEqualTo(2);
        }
        assertThat(loads.get()).isEqualTo(1);
        assertThat(cache.openLeases("accounts")).isZero();
        assertThat(cache.cachedDatasets()).containsExactly("accounts");
    }

    @Test
    void evictionKeepsHandedOutRecordsAndReloadsNextTime() throws IOException {
        CanonicalDatasetCache.Lease lease = cache.acquire(TestDescriptors.accounts("accounts"), this::load);

        assertThat(cache.evict("accounts")).isTrue();
        assertThat(lease.getRecords()).hasSize(1);
        lease.close();
        lease.close();

        cache.acquire(TestDescriptors.accounts("accounts"), this::load).close();
        assertThat(loads.get()).isEqualTo(2);
        assertThat(cache.evict("unknown")).isFalse();
    }

    @Test
    void changedDescriptorUnderTheSameNameReloads() throws IOException {
        DatasetDescriptor untyped =
                TestDescriptors.withColumnMap("accounts", Map.of(), Map.of());
        CanonicalDatasetCache.Lease typed = cache.acquire(TestDescriptors.accounts("accounts"), this::load);

        try (CanonicalDatasetCache.Lease reloaded = cache.acquire(untyped, this::load)) {
            assertThat(reloaded.getRecords()).isNotSameAs(typed.getRecords());
            assertThat(cache.openLeases("accounts")).isEqualTo(1);
        }
        typed.close();
        cache.acquire(untyped, this::load).close();

        assertThat(loads.get()).isEqualTo(2);
        assertThat(cache.cachedDatasets()).containsExactly("accounts");
    }

    @Test
    void clearDropsEverything() throws IOException {
        cache.acquire(TestDescriptors.accounts("a"), this::load).close();
        cache.acquire(TestDescriptors.accounts("b"), this::load).close();

        assertThat(cache.clear()).isEqualTo(2);
        assertThat(cache.cachedDatasets()).isEmpty();
    }

    @Test
    void failedLoadIsNotCached() {
        assertThatThrownBy(() -> cache.acquire(TestDescriptors.accounts("broken"), () -> {
                    throw new IOException("unreadable");
                }))
                .isInstanceOf(IOException.class);
        assertThat(cache.cachedDatasets()).isEmpty();
    }

    private List<CanonicalRecord> load() {
        loads.incrementAndGet();
        return List.of(new CanonicalRecord("K", "K", 1, Map.of("ID", "K")));
    }
}
