package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.AlignedEntry;
import com.example.migrationcompare.domain.ComparisonRequest;
import com.example.migrationcompare.domain.ComparisonSummary;
import com.example.migrationcompare.domain.ComparisonTiming;
import com.example.migrationcompare.domain.DifferenceRecord;
import com.example.migrationcompare.domain.DuplicateKeyPolicy;
import com.example.migrationcompare.domain.RawRecord;
import com.example.migrationcompare.domain.StepTiming;
import com.example.migrationcompare.exception.CancellationRequestedException;
import com.example.migrationcompare.exception.ComparisonTimeoutException;
import com.example.migrationcompare.exception.InputReadException;
import com.example.migrationcompare.exception.NormalizationException;
import com.example.migrationcompare.exception.ResultWriteException;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one comparison end to end: validate, read and normalize both sides concurrently into
 * key-hash partitions, then align, classify and persist partition by partition on a worker pool.
 *
 * <p>The engine reports progress only through the {@link ProgressSink} it is handed and never
 * changes job state itself. Fatal conditions surface as
 * {@link com.example.migrationcompare.exception.ComparisonException} subclasses.
 */
@Service
public class ComparisonEngine {
    private static final Logger log = LogManager.getLogger(ComparisonEngine.class);
    private static final int IN_FLIGHT_PER_WORKER = 2;

    private final DatasetReader datasetReader;
    private final ResultStore resultStore;
    private final PartitionBufferFactory bufferFactory;
    private final DescriptorValidator validator;
    private final DatasetAligner aligner;
    private final Clock clock;
    private final int workerThreads;
    private final int partitionCount;
    private final int readBatchSize;
    private final Duration partitionTimeout;
    private final Duration readTimeout;
    private final IoRetry ioRetry;
    private final ExecutorService executor;

    public ComparisonEngine(
            DatasetReader datasetReader,
            ResultStore resultStore,
            PartitionBufferFactory bufferFactory,
            DescriptorValidator validator,
            DatasetAligner aligner,
            Clock clock,
            @Value("${comparison.engine.worker-threads:0}") int workerThreads,
            @Value("${comparison.engine.partition-count:64}") int partitionCount,
            @Value("${comparison.engine.read-batch-size:10000}") int readBatchSize,
            @Value("${comparison.engine.partition-timeout:PT5M}") Duration partitionTimeout,
            @Value("${comparison.engine.read-timeout:PT2H}") Duration readTimeout,
            @Value("${comparison.engine.io-max-attempts:3}") int ioMaxAttempts,
            @Value("${comparison.engine.io-retry-backoff:PT0.5S}") Duration ioRetryBackoff) {
        this.datasetReader = datasetReader;
        this.resultStore = resultStore;
        this.bufferFactory = bufferFactory;
        this.validator = validator;
        this.aligner = aligner;
        this.clock = clock;
        int defaultPoolSize = Runtime.getRuntime().availableProcessors();
        int configuredPoolSize = workerThreads > 0 ? workerThreads : defaultPoolSize;
        this.workerThreads = Math.max(2, configuredPoolSize);
        this.partitionCount = Math.max(1, partitionCount);
        this.readBatchSize = Math.max(1, readBatchSize);
        this.partitionTimeout = partitionTimeout;
        this.readTimeout = readTimeout;
        this.ioRetry = new IoRetry(ioMaxAttempts, ioRetryBackoff);
        this.executor = Executors.newFixedThreadPool(this.workerThreads);
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    private double recordStep(List<StepTiming> timings, String label, long startNanos) {
        double seconds = nanosToSeconds(System.nanoTime() - startNanos);
        timings.add(new StepTiming(label, seconds));
        return seconds;
    }

    public ComparisonSummary run(
            String jobId, ComparisonRequest request, ProgressSink sink, CancellationToken token) {
        List<StepTiming> timings = Collections.synchronizedList(new ArrayList<>());
        long overallStart = System.nanoTime();

        long validateStart = System.nanoTime();
        CompiledComparison comparison = validator.validate(request);
        recordStep(timings, "Validate descriptors", validateStart);

        PartitionBuffer sourceBuffer = null;
        PartitionBuffer targetBuffer = null;
        try {
            sourceBuffer = bufferFactory.create(jobId, DatasetAligner.SOURCE, partitionCount);
            targetBuffer = bufferFactory.create(jobId, DatasetAligner.TARGET, partitionCount);

            sink.started();
            token.checkpoint();
            sink.phase("Reading datasets");
            long readStart = System.nanoTime();
            SideStats sourceStats = new SideStats();
            SideStats targetStats = new SideStats();
            readBothSides(jobId, comparison, sourceBuffer, targetBuffer, sourceStats, targetStats, token);
            double readSeconds = recordStep(timings, "Read and normalize datasets", readStart);
            log.info(
                    "Job {}: read datasets in {}s (source {} rows, target {} rows)",
                    jobId, readSeconds, sourceStats.rowsRead, targetStats.rowsRead);

            // upper bound on distinct keys, so progress only reaches it on the final report
            long estimate = sourceBuffer.size() + targetBuffer.size();
            sink.progress(0, estimate);
            sink.phase("Aligning and classifying");
            long alignStart = System.nanoTime();
            RunCounters counters = new RunCounters();
            long processed =
                    processPartitions(
                            jobId, comparison, sourceBuffer, targetBuffer, counters, sink, token, estimate);
            double alignSeconds = recordStep(timings, "Align, classify and persist", alignStart);
            log.info("Job {}: classified {} keys in {}s", jobId, processed, alignSeconds);
            sink.progress(processed, processed);

            double totalSeconds = nanosToSeconds(System.nanoTime() - overallStart);
            List<StepTiming> stepSnapshot;
            synchronized (timings) {
                stepSnapshot = List.copyOf(timings);
            }
            return ComparisonSummary.builder()
                    .sourceRowsRead(sourceStats.rowsRead)
                    .targetRowsRead(targetStats.rowsRead)
                    .sourceRowsSkipped(sourceStats.skipped())
                    .targetRowsSkipped(targetStats.skipped())
                    .sourceDuplicatesCollapsed(counters.sourceDuplicates.get())
                    .targetDuplicatesCollapsed(counters.targetDuplicates.get())
                    .keysCompared(processed)
                    .matchedKeys(counters.matched.get())
                    .mismatchedKeys(counters.mismatched.get())
                    .sourceOnlyKeys(counters.sourceOnly.get())
                    .targetOnlyKeys(counters.targetOnly.get())
                    .differenceRows(counters.differenceRows.get())
                    .timing(new ComparisonTiming(stepSnapshot, totalSeconds))
                    .build();
        } catch (IOException ex) {
            throw new InputReadException("Failed to prepare partition buffers for job " + jobId, ex);
        } finally {
            close(jobId, sourceBuffer);
            close(jobId, targetBuffer);
        }
    }

    private void readBothSides(
            String jobId,
            CompiledComparison comparison,
            PartitionBuffer sourceBuffer,
            PartitionBuffer targetBuffer,
            SideStats sourceStats,
            SideStats targetStats,
            CancellationToken token) {
        RecordNormalizer normalizer = new RecordNormalizer(comparison.settings());
        CancellationToken abort = new CancellationToken(jobId);
        CompletionService<Void> reads = new ExecutorCompletionService<>(executor);
        List<Future<Void>> futures = List.of(
                reads.submit(() -> {
                    loadSide(jobId, DatasetAligner.SOURCE, comparison.source(), sourceBuffer,
                            normalizer, sourceStats, token, abort);
                    return null;
                }),
                reads.submit(() -> {
                    loadSide(jobId, DatasetAligner.TARGET, comparison.target(), targetBuffer,
                            normalizer, targetStats, token, abort);
                    return null;
                }));
        long deadline = System.nanoTime() + readTimeout.toNanos();
        boolean finished = false;
        try {
            for (int i = 0; i < futures.size(); i++) {
                Future<Void> done = reads.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (done == null) {
                    throw new ComparisonTimeoutException(
                            "Reading the datasets of job " + jobId + " did not finish within " + readTimeout);
                }
                done.get();
            }
            finished = true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CancellationRequestedException(jobId);
        } catch (ExecutionException ex) {
            throw propagate(ex.getCause());
        } finally {
            if (!finished) {
                // interrupt readers blocked in I/O, the flag stops those between batches
                abort.cancel();
                futures.forEach(future -> future.cancel(true));
            }
        }
    }

    private void loadSide(
            String jobId,
            String side,
            CompiledDescriptor descriptor,
            PartitionBuffer buffer,
            RecordNormalizer normalizer,
            SideStats stats,
            CancellationToken token,
            CancellationToken abort) {
        String description = "Reading " + side + " dataset '" + descriptor.name() + "'";
        try {
            stats.rowsRead =
                    ioRetry.call(
                            description,
                            () -> {
                                buffer.clear();
                                stats.reset();
                                long rows =
                                        datasetReader.read(
                                                descriptor.descriptor(),
                                                readBatchSize,
                                                batch -> {
                                                    token.checkpoint();
                                                    abort.checkpoint();
                                                    normalizeBatch(jobId, side, batch, descriptor, buffer, normalizer, stats);
                                                });
                                buffer.seal();
                                return rows;
                            });
        } catch (IOException ex) {
            throw new InputReadException(
                    String.format(
                            "%s failed after %d attempt(s): %s",
                            description, ioRetry.getMaxAttempts(), ex.getMessage()),
                    ex);
        }
        log.info(
                "Job {}: {} dataset '{}' read {} rows, skipped {} (missing column {}, type coercion {})",
                jobId, side, descriptor.name(), stats.rowsRead, stats.skipped(),
                stats.missingColumn, stats.typeCoercion);
    }

    private void normalizeBatch(
            String jobId,
            String side,
            List<RawRecord> batch,
            CompiledDescriptor descriptor,
            PartitionBuffer buffer,
            RecordNormalizer normalizer,
            SideStats stats)
            throws IOException {
        for (RawRecord raw : batch) {
            try {
                buffer.add(normalizer.normalize(raw, descriptor));
            } catch (NormalizationException ex) {
                stats.count(ex.getKind());
                log.debug("Job {}: skipped {} row: {}", jobId, side, ex.getMessage());
            }
        }
    }

    private long processPartitions(
            String jobId,
            CompiledComparison comparison,
            PartitionBuffer sourceBuffer,
            PartitionBuffer targetBuffer,
            RunCounters counters,
            ProgressSink sink,
            CancellationToken token,
            long estimate) {
        CompletionService<PartitionOutcome> completionService =
                new ExecutorCompletionService<>(executor);
        DifferenceClassifier classifier =
                new DifferenceClassifier(jobId, comparison.settings(), clock);
        DuplicateKeyPolicy policy = comparison.settings().duplicateKeyPolicy();
        int maxInFlight = workerThreads * IN_FLIGHT_PER_WORKER;

        List<Future<PartitionOutcome>> submitted = new ArrayList<>();
        int next = 0;
        int completed = 0;
        long processed = 0;
        try {
            while (completed < partitionCount) {
                while (next < partitionCount && next - completed < maxInFlight) {
                    token.checkpoint();
                    int partition = next++;
                    submitted.add(
                            completionService.submit(
                                    () -> processPartition(
                                            jobId, partition, sourceBuffer, targetBuffer, policy,
                                            classifier, comparison.valueColumns(), counters, token)));
                }
                Future<PartitionOutcome> done =
                        completionService.poll(partitionTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (done == null) {
                    throw new ComparisonTimeoutException(
                            "No partition of job " + jobId + " finished within " + partitionTimeout);
                }
                PartitionOutcome outcome = done.get();
                completed++;
                processed += outcome.keys();
                sink.progress(processed, estimate);
                log.debug(
                        "Job {}: partition {} aligned {} keys into {} rows in {}s",
                        jobId, outcome.partition(), outcome.keys(), outcome.rows(), outcome.seconds());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CancellationRequestedException(jobId);
        } catch (ExecutionException ex) {
            throw propagate(ex.getCause());
        } finally {
            if (completed < partitionCount) {
                submitted.forEach(future -> future.cancel(true));
            }
        }
        return processed;
    }

    private PartitionOutcome processPartition(
            String jobId,
            int partition,
            PartitionBuffer sourceBuffer,
            PartitionBuffer targetBuffer,
            DuplicateKeyPolicy policy,
            DifferenceClassifier classifier,
            List<String> valueColumns,
            RunCounters counters,
            CancellationToken token) {
        token.checkpoint();
        long start = System.nanoTime();
        AlignmentResult alignment = aligner.alignPartition(sourceBuffer, targetBuffer, partition, policy);
        List<DifferenceRecord> rows = new ArrayList<>();
        for (AlignedEntry entry : alignment.entries()) {
            List<DifferenceRecord> differences = classifier.classify(entry, valueColumns);
            counters.record(entry, differences.size());
            rows.addAll(differences);
        }
        counters.sourceDuplicates.addAndGet(alignment.sourceDuplicates());
        counters.targetDuplicates.addAndGet(alignment.targetDuplicates());

        if (!rows.isEmpty()) {
            try {
                ioRetry.call(
                        "Writing partition " + partition + " of job " + jobId,
                        () -> {
                            resultStore.write(jobId, partition, rows);
                            return null;
                        });
            } catch (IOException ex) {
                throw new ResultWriteException(
                        "Failed to write partition " + partition + " of job " + jobId, ex);
            }
        }
        counters.differenceRows.addAndGet(rows.size());
        return new PartitionOutcome(
                partition, alignment.entries().size(), rows.size(), nanosToSeconds(System.nanoTime() - start));
    }

    private static RuntimeException propagate(Throwable cause) {
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof IOException io) {
            return new UncheckedIOException(io);
        }
        return new IllegalStateException("Comparison task failed", cause);
    }

    private void close(String jobId, PartitionBuffer buffer) {
        if (buffer == null) {
            return;
        }
        try {
            buffer.close();
        } catch (IOException ex) {
            log.warn("Job {}: failed to release partition buffer: {}", jobId, ex.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private record PartitionOutcome(int partition, int keys, int rows, double seconds) {}

    private static final class SideStats {
        private long rowsRead;
        private long missingColumn;
        private long typeCoercion;

        void reset() {
            rowsRead = 0;
            missingColumn = 0;
            typeCoercion = 0;
        }

        void count(NormalizationException.Kind kind) {
            if (kind == NormalizationException.Kind.MISSING_REQUIRED_COLUMN) {
                missingColumn++;
            } else {
                typeCoercion++;
            }
        }

        long skipped() {
            return missingColumn + typeCoercion;
        }
    }

    private static final class RunCounters {
        private final AtomicLong matched = new AtomicLong();
        private final AtomicLong mismatched = new AtomicLong();
        private final AtomicLong sourceOnly = new AtomicLong();
        private final AtomicLong targetOnly = new AtomicLong();
        private final AtomicLong differenceRows = new AtomicLong();
        private final AtomicLong sourceDuplicates = new AtomicLong();
        private final AtomicLong targetDuplicates = new AtomicLong();

        void record(AlignedEntry entry, int differences) {
            if (entry instanceof AlignedEntry.SourceOnly) {
                sourceOnly.incrementAndGet();
            } else if (entry instanceof AlignedEntry.TargetOnly) {
                targetOnly.incrementAndGet();
            } else if (differences == 0) {
                matched.incrementAndGet();
            } else {
                mismatched.incrementAndGet();
            }
        }
    }
}
