package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.ComparisonJob;
import com.example.migrationcompare.domain.ComparisonRequest;
import com.example.migrationcompare.domain.ComparisonSummary;
import com.example.migrationcompare.domain.DifferenceRecord;
import com.example.migrationcompare.domain.JobError;
import com.example.migrationcompare.domain.JobErrorCode;
import com.example.migrationcompare.domain.JobProgress;
import com.example.migrationcompare.domain.JobStatus;
import com.example.migrationcompare.exception.CancellationRequestedException;
import com.example.migrationcompare.exception.ComparisonException;
import com.example.migrationcompare.exception.ConfigurationException;
import com.example.migrationcompare.exception.JobNotFoundException;
import com.example.migrationcompare.infrastructure.persistence.ComparisonJobEntity;
import com.example.migrationcompare.infrastructure.persistence.ComparisonJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Owns the lifecycle of comparison jobs. This is the only class that writes job rows: the engine
 * reports through a {@link ProgressSink} created here, and every mutation goes through
 * {@link #update(String, Consumer)} under the lock stripe of its job.
 */
@Service
public class ComparisonJobService {
    private static final Logger log = LogManager.getLogger(ComparisonJobService.class);
    private static final int MAX_ERROR_DETAIL = 4000;
    static final int LOCK_STRIPES = 64;

    private final ComparisonJobRepository repository;
    private final ComparisonEngine engine;
    private final DescriptorValidator validator;
    private final ResultStore resultStore;
    private final TaskExecutor executor;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration progressFlushInterval;

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Object[] locks = new Object[LOCK_STRIPES];

    public ComparisonJobService(
            ComparisonJobRepository repository,
            ComparisonEngine engine,
            DescriptorValidator validator,
            ResultStore resultStore,
            @Qualifier("comparisonJobExecutor") TaskExecutor executor,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${comparison.jobs.progress-flush-interval:PT1S}") Duration progressFlushInterval) {
        this.repository = repository;
        this.engine = engine;
        this.validator = validator;
        this.resultStore = resultStore;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.progressFlushInterval = progressFlushInterval;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    /**
     * Validates the request, records a queued job and schedules it. Returns as soon as the job is
     * scheduled.
     *
     * @throws ConfigurationException when the request is invalid; no job is created
     */
    public String submit(ComparisonRequest request) {
        validator.validate(request);

        String jobId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        ComparisonJobEntity entity = new ComparisonJobEntity();
        entity.setJobId(jobId);
        entity.setStatus(JobStatus.QUEUED);
        entity.setSourceDataset(request.source().name());
        entity.setTargetDataset(request.target().name());
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        entity.setProgressMessage("Queued");
        entity.setResultLocation(resultStore.locationOf(jobId));
        entity.setRequestJson(toJson(request));
        entity.setMappingVersion(request.mappingVersion());
        entity.setSchemaVersion(DifferenceRecord.SCHEMA_VERSION);
        repository.save(entity);
        tokens.put(jobId, new CancellationToken(jobId));
        log.info(
                "Job {} queued: {} vs {}", jobId, request.source().name(), request.target().name());

        try {
            executor.execute(() -> runJob(jobId, request));
        } catch (TaskRejectedException ex) {
            log.warn("Job {} rejected by the job executor: {}", jobId, ex.getMessage());
            fail(jobId, JobErrorCode.REJECTED, "Job queue is full");
            tokens.remove(jobId);
        }
        return jobId;
    }

    public ComparisonJob getStatus(String jobId) {
        return toView(load(jobId));
    }

    public List<ComparisonJob> listJobs(String dataset, JobStatus status) {
        String datasetFilter = dataset == null || dataset.isBlank() ? null : dataset.trim();
        return repository.search(datasetFilter, status).stream().map(this::toView).toList();
    }

    /**
     * Requests cooperative cancellation. A queued job fails immediately; a running job fails once
     * the engine reaches its next batch or partition boundary.
     */
    public ComparisonJob cancel(String jobId) {
        CancellationToken token = tokens.get(jobId);
        if (token != null) {
            token.cancel();
        }
        ComparisonJobEntity entity =
                update(
                        jobId,
                        job -> {
                            if (job.getStatus().isTerminal()) {
                                throw new IllegalStateException(
                                        "Job " + jobId + " is already " + job.getStatus().value());
                            }
                            if (job.getStatus() == JobStatus.QUEUED) {
                                applyFailure(job, JobErrorCode.CANCELLED, "Cancelled before start");
                            } else {
                                job.setProgressMessage("Cancellation requested");
                            }
                        });
        log.info("Job {} cancellation requested", jobId);
        return toView(entity);
    }

    /**
     * Removes a finished job and its stored rows.
     */
    public void delete(String jobId) {
        synchronized (lockFor(jobId)) {
            ComparisonJobEntity entity = load(jobId);
            if (!entity.getStatus().isTerminal()) {
                throw new IllegalStateException(
                        "Job " + jobId + " is " + entity.getStatus().value() + " and cannot be deleted");
            }
            resultStore.deleteByJob(jobId);
            repository.delete(entity);
        }
        log.info("Job {} deleted", jobId);
    }

    /**
     * Jobs left queued or running by a previous process can never finish; fail them on startup.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void failInterruptedJobs() {
        for (JobStatus status : List.of(JobStatus.QUEUED, JobStatus.RUNNING)) {
            for (ComparisonJobEntity job : repository.search(null, status)) {
                if (!tokens.containsKey(job.getJobId())) {
                    log.warn("Job {} was {} when the service stopped", job.getJobId(), status.value());
                    fail(job.getJobId(), JobErrorCode.INTERNAL_ERROR, "Interrupted by a service restart");
                }
            }
        }
    }

    void runJob(String jobId, ComparisonRequest request) {
        CancellationToken token = tokens.computeIfAbsent(jobId, CancellationToken::new);
        JobProgressPublisher publisher = new JobProgressPublisher(jobId);
        try {
            ComparisonSummary summary = engine.run(jobId, request, publisher, token);
            complete(jobId, summary);
        } catch (CancellationRequestedException ex) {
            log.warn("Job {} cancelled", jobId);
            fail(jobId, ex.getErrorCode(), ex.getMessage());
        } catch (ComparisonException ex) {
            log.warn("Job {} failed with {}: {}", jobId, ex.getErrorCode(), ex.getMessage());
            fail(jobId, ex.getErrorCode(), ex.getMessage());
        } catch (ConfigurationException ex) {
            log.warn("Job {} failed validation: {}", jobId, ex.getMessage());
            fail(jobId, JobErrorCode.CONFIGURATION, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Job {} failed unexpectedly", jobId, ex);
            fail(jobId, JobErrorCode.INTERNAL_ERROR, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        } finally {
            tokens.remove(jobId);
        }
    }

    private void complete(String jobId, ComparisonSummary summary) {
        update(
                jobId,
                job -> {
                    if (!job.getStatus().canTransitionTo(JobStatus.COMPLETED)) {
                        log.warn("Job {} finished but is already {}", jobId, job.getStatus().value());
                        return;
                    }
                    Instant now = clock.instant();
                    job.setStatus(JobStatus.COMPLETED);
                    job.setCompletedAt(now);
                    job.setKeysProcessed(summary.getKeysCompared());
                    job.setTotalKeys(summary.getKeysCompared());
                    job.setProgressPercent(100.0);
                    job.setProgressMessage("Completed");
                    job.setSummaryJson(toJson(summary));
                });
        log.info(
                "Job {} completed: {} keys, {} difference rows",
                jobId, summary.getKeysCompared(), summary.getDifferenceRows());
    }

    private void fail(String jobId, JobErrorCode code, String detail) {
        update(
                jobId,
                job -> {
                    if (!job.getStatus().canTransitionTo(JobStatus.FAILED)) {
                        log.debug("Job {} is already {}, ignoring {}", jobId, job.getStatus().value(), code);
                        return;
                    }
                    applyFailure(job, code, detail);
                });
    }

    private void applyFailure(ComparisonJobEntity job, JobErrorCode code, String detail) {
        Instant now = clock.instant();
        job.setStatus(JobStatus.FAILED);
        job.setCompletedAt(now);
        job.setErrorCode(code);
        String message = detail == null ? code.name() : detail;
        job.setErrorDetail(
                message.length() > MAX_ERROR_DETAIL ? message.substring(0, MAX_ERROR_DETAIL) : message);
        job.setProgressMessage("Failed");
    }

    private ComparisonJobEntity update(String jobId, Consumer<ComparisonJobEntity> mutation) {
        synchronized (lockFor(jobId)) {
            ComparisonJobEntity entity = load(jobId);
            mutation.accept(entity);
            entity.setUpdatedAt(clock.instant());
            return repository.save(entity);
        }
    }

    Object lockFor(String jobId) {
        return locks[Math.floorMod(jobId.hashCode(), locks.length)];
    }

    private ComparisonJobEntity load(String jobId) {
        return repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    private ComparisonJob toView(ComparisonJobEntity entity) {
        JobError error =
                entity.getErrorCode() == null
                        ? null
                        : new JobError(entity.getErrorCode(), entity.getErrorDetail());
        return new ComparisonJob(
                entity.getJobId(),
                entity.getStatus(),
                entity.getSourceDataset(),
                entity.getTargetDataset(),
                entity.getCreatedAt(),
                entity.getUpdatedAt(),
                entity.getStartedAt(),
                entity.getCompletedAt(),
                new JobProgress(
                        entity.getKeysProcessed(),
                        entity.getTotalKeys(),
                        entity.getProgressPercent(),
                        entity.getProgressMessage()),
                error,
                entity.getResultLocation(),
                fromJson(entity.getSummaryJson()),
                entity.getMappingVersion(),
                entity.getSchemaVersion());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), ex);
        }
    }

    private ComparisonSummary fromJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ComparisonSummary.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to read job summary", ex);
        }
    }

    /**
     * Progress sink handed to the engine for one job. Progress rows are throttled; the first and
     * the final update always go through.
     */
    private final class JobProgressPublisher implements ProgressSink {
        private final String jobId;
        private volatile long lastFlushNanos;

        private JobProgressPublisher(String jobId) {
            this.jobId = jobId;
        }

        @Override
        public void started() {
            ComparisonJobEntity entity =
                    update(
                            jobId,
                            job -> {
                                if (!job.getStatus().canTransitionTo(JobStatus.RUNNING)) {
                                    return;
                                }
                                job.setStatus(JobStatus.RUNNING);
                                job.setStartedAt(clock.instant());
                                job.setProgressMessage("Started");
                            });
            if (entity.getStatus() != JobStatus.RUNNING) {
                throw new CancellationRequestedException(jobId);
            }
            log.info("Job {} started", jobId);
        }

        @Override
        public void phase(String message) {
            update(
                    jobId,
                    job -> {
                        if (job.getStatus() == JobStatus.RUNNING) {
                            job.setProgressMessage(message);
                        }
                    });
        }

        @Override
        public void progress(long keysProcessed, Long estimatedTotal) {
            long now = System.nanoTime();
            boolean last = estimatedTotal != null && keysProcessed >= estimatedTotal;
            if (!last && keysProcessed > 0 && now - lastFlushNanos < progressFlushInterval.toNanos()) {
                return;
            }
            lastFlushNanos = now;
            update(
                    jobId,
                    job -> {
                        if (job.getStatus() != JobStatus.RUNNING
                                || keysProcessed < job.getKeysProcessed()) {
                            return;
                        }
                        job.setKeysProcessed(keysProcessed);
                        job.setTotalKeys(estimatedTotal);
                        job.setProgressPercent(percent(keysProcessed, estimatedTotal));
                    });
        }

        private double percent(long processed, Long total) {
            if (total == null || total <= 0) {
                return 0.0;
            }
            return Math.min(100.0, Math.round(processed * 10_000.0 / total) / 100.0);
        }
    }
}
