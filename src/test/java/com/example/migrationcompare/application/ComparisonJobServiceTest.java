package com.example.migrationcompare.application;

import com.example.migrationcompare.domain.ComparisonJob;
import com.example.migrationcompare.domain.ComparisonRequest;
import com.example.migrationcompare.domain.ComparisonSettings;
import com.example.migrationcompare.domain.ComparisonSummary;
import com.example.migrationcompare.domain.JobErrorCode;
import com.example.migrationcompare.domain.JobStatus;
import com.example.migrationcompare.exception.ConfigurationException;
import com.example.migrationcompare.exception.DuplicateKeyException;
import com.example.migrationcompare.exception.JobNotFoundException;
import com.example.migrationcompare.infrastructure.persistence.ComparisonJobEntity;
import com.example.migrationcompare.infrastructure.persistence.ComparisonJobRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComparisonJobServiceTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T08:00:00Z"), ZoneOffset.UTC);

    @Mock private ComparisonJobRepository repository;
    @Mock private ComparisonEngine engine;
    @Mock private ResultStore resultStore;

    private final Map<String, ComparisonJobEntity> rows = new ConcurrentHashMap<>();
    private final List<Runnable> scheduled = new ArrayList<>();

    @BeforeEach
    void setUp() {
        lenient().when(repository.save(any(ComparisonJobEntity.class)))
                .thenAnswer(invocation -> {
                    ComparisonJobEntity entity = invocation.getArgument(0);
                    rows.put(entity.getJobId(), entity);
                    return entity;
                });
        lenient().when(repository.findById(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(rows.get(invocation.<String>getArgument(0))));
        lenient().when(resultStore.locationOf(anyString())).thenAnswer(invocation -> "/results/" + invocation.getArgument(0));
    }

    @Test
    void submittedJobRunsToCompletion() {
        when(engine.run(anyString(), any(), any(), any()))
                .thenAnswer(invocation -> {
                    ProgressSink sink = invocation.getArgument(2);
                    sink.started();
                    sink.progress(10, 10L);
                    return summary(10);
                });

        String jobId = service(Runnable::run).submit(request());

        ComparisonJob job = service(Runnable::run).getStatus(jobId);
        assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.startedAt()).isEqualTo(CLOCK.instant());
        assertThat(job.completedAt()).isEqualTo(CLOCK.instant());
        assertThat(job.progress().keysProcessed()).isEqualTo(10);
        assertThat(job.progress().percent()).isEqualTo(100.0);
        assertThat(job.summary().getKeysCompared()).isEqualTo(10);
        assertThat(job.resultLocation()).isEqualTo("/results/" + jobId);
        assertThat(job.schemaVersion()).isEqualTo("1.0");
        assertThat(job.error()).isNull();
    }

    @Test
    void submitReturnsBeforeTheJobRuns() {
        ComparisonJobService service = service(scheduled::add);

        String jobId = service.submit(request());

        assertThat(service.getStatus(jobId).status()).isEqualTo(JobStatus.QUEUED);
        assertThat(scheduled).hasSize(1);
        verifyNoInteractions(engine);
    }

    @Test
    void duplicateKeyFailsTheJob() {
        when(engine.run(anyString(), any(), any(), any()))
                .thenAnswer(invocation -> {
                    invocation.<ProgressSink>getArgument(2).started();
                    throw new DuplicateKeyException(DatasetAligner.SOURCE, "K3", "K3");
                });
        ComparisonJobService service = service(Runnable::run);

        ComparisonJob job = service.getStatus(service.submit(request()));

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.error().code()).isEqualTo(JobErrorCode.DUPLICATE_KEY);
        assertThat(job.error().detail()).contains("K3");
    }

    @Test
    void invalidSubmissionCreatesNoJob() {
        ComparisonRequest request =
                new ComparisonRequest(
                        TestDescriptors.withColumnMap("legacy", Map.of("NAME", "NAME", "QTY", "QTY"), Map.of()),
                        TestDescriptors.accounts("new"),
                        ComparisonSettings.withTolerance(BigDecimal.ZERO));

        assertThatThrownBy(() -> service(Runnable::run).submit(request))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Primary key column 'ID'");
        verify(repository, never()).save(any());
        verifyNoInteractions(engine);
    }

    @Test
    void rejectedSubmissionFailsImmediately() {
        ComparisonJobService service =
                service(task -> {
                    throw new TaskRejectedException("queue full");
                });

        ComparisonJob job = service.getStatus(service.submit(request()));

        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.error().code()).isEqualTo(JobErrorCode.REJECTED);
    }

    @Test
    void cancellingAQueuedJobFailsItBeforeItStarts() {
        when(engine.run(anyString(), any(), any(), any()))
                .thenAnswer(invocation -> {
                    invocation.<ProgressSink>getArgument(2).started();
                    return summary(0);
                });
        ComparisonJobService service = service(scheduled::add);
        String jobId = service.submit(request());

        service.cancel(jobId);
        scheduled.forEach(Runnable::run);

        ComparisonJob job = service.getStatus(jobId);
        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.error().code()).isEqualTo(JobErrorCode.CANCELLED);
        assertThat(job.startedAt()).isNull();
    }

    @Test
    void cancellingARunningJobSignalsTheEngine() {
        ComparisonJobService service = service(scheduled::add);
        String jobId = service.submit(request());
        when(engine.run(eq(jobId), any(), any(), any()))
                .thenAnswer(invocation -> {
                    invocation.<ProgressSink>getArgument(2).started();
                    service.cancel(jobId);
                    invocation.<CancellationToken>getArgument(3).checkpoint();
                    return summary(0);
                });

        scheduled.forEach(Runnable::run);

        ComparisonJob job = service.getStatus(jobId);
        assertThat(job.status()).isEqualTo(JobStatus.FAILED);
        assertThat(job.error().code()).isEqualTo(JobErrorCode.CANCELLED);
    }

    @Test
    void terminalJobsCannotBeCancelled() {
        when(engine.run(anyString(), any(), any(), any()))
                .thenAnswer(invocation -> {
                    invocation.<ProgressSink>getArgument(2).started();
                    return summary(1);
                });
        ComparisonJobService service = service(Runnable::run);
        String jobId = service.submit(request());

        assertThatThrownBy(() -> service.cancel(jobId)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void progressIsVisibleWhileRunningAndNeverGoesBackwards() {
        List<ComparisonJob> observed = new ArrayList<>();
        ComparisonJobService service = service(scheduled::add);
        String jobId = service.submit(request());
        when(engine.run(eq(jobId), any(), any(), any()))
                .thenAnswer(invocation -> {
                    ProgressSink sink = invocation.getArgument(2);
                    sink.started();
                    sink.progress(5, 8L);
                    observed.add(service.getStatus(jobId));
                    sink.progress(3, 8L);
                    observed.add(service.getStatus(jobId));
                    return summary(8);
                });

        scheduled.forEach(Runnable::run);

        assertThat(observed).allSatisfy(job -> {
            assertThat(job.status()).isEqualTo(JobStatus.RUNNING);
            assertThat(job.progress().keysProcessed()).isEqualTo(5);
            assertThat(job.progress().percent()).isEqualTo(62.5);
        });
    }

    @Test
    void deleteRemovesOnlyFinishedJobs() {
        ComparisonJobService service = service(scheduled::add);
        String jobId = service.submit(request());

        assertThatThrownBy(() -> service.delete(jobId)).isInstanceOf(IllegalStateException.class);

        service.cancel(jobId);
        service.delete(jobId);

        verify(resultStore).deleteByJob(jobId);
        verify(repository).delete(rows.get(jobId));
    }

    @Test
    void unknownJobIsReported() {
        assertThatThrownBy(() -> service(Runnable::run).getStatus("missing"))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void jobsLeftRunningByAPreviousProcessAreFailedOnStartup() {
        ComparisonJobEntity orphan = new ComparisonJobEntity();
        orphan.setJobId("orphan");
        orphan.setStatus(JobStatus.RUNNING);
        rows.put("orphan", orphan);
        when(repository.search(null, JobStatus.QUEUED)).thenReturn(List.of());
        when(repository.search(null, JobStatus.RUNNING)).thenReturn(List.of(orphan));

        service(Runnable::run).failInterruptedJobs();

        assertThat(orphan.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(orphan.getErrorCode()).isEqualTo(JobErrorCode.INTERNAL_ERROR);
    }

    @Test
    void finishedJobsDoNotGrowTheLockTable() {
        when(engine.run(anyString(), any(), any(), any())).thenReturn(summary(1));
        ComparisonJobService service = service(Runnable::run);

        Set<Object> locks = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 200; i++) {
            String jobId = service.submit(request());
            assertThat(service.getStatus(jobId).status()).isEqualTo(JobStatus.COMPLETED);
            assertThat(service.lockFor(jobId)).isSameAs(service.lockFor(jobId));
            locks.add(service.lockFor(jobId));
        }

        assertThat(locks).hasSizeLessThanOrEqualTo(ComparisonJobService.LOCK_STRIPES);
    }

    private ComparisonJobService service(TaskExecutor executor) {
        return new ComparisonJobService(
                repository,
                engine,
                new DescriptorValidator(),
                resultStore,
                executor,
                new ObjectMapper(),
                CLOCK,
                Duration.ZERO);
    }

    private static ComparisonRequest request() {
        return new ComparisonRequest(
                TestDescriptors.accounts("legacy"),
                TestDescriptors.accounts("new"),
                ComparisonSettings.withTolerance(new BigDecimal("0.01")));
    }

    private static ComparisonSummary summary(long keys) {
        return ComparisonSummary.builder().keysCompared(keys).matchedKeys(keys).build();
    }
}
