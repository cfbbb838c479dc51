package com.demandengine.service;

import com.demandengine.dto.AsyncJobResponse;
import com.demandengine.dto.AsyncJobStatus;
import com.demandengine.dto.AsyncJobType;
import com.demandengine.dto.BatchForecastResponse;
import com.demandengine.dto.ScopeRef;
import com.demandengine.exception.DemandEngineException;
import com.demandengine.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * In-memory registry of background batch forecasts. A batch is validated as a whole
 * before it is queued, so a job only fails on errors that escape per-scope
 * isolation. Finished jobs are evicted oldest first once more than
 * {@code jobs.max-retained} are held.
 */
@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:4}")
    private int poolSize;

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    private final ForecastOrchestrator orchestrator;
    private final Clock clock;
    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, BatchJob> jobs = new ConcurrentHashMap<>();

    public AsyncJobService(ForecastOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    /** Validates the batch synchronously, then queues it. */
    public AsyncJobResponse submitBatchForecast(List<ScopeRef> scopes, int horizonDays, String requestId) {
        orchestrator.validateBatch(scopes, horizonDays);
        UUID jobId = submit(AsyncJobType.FORECAST_BATCH, requestId,
            () -> orchestrator.generateBatchBlocking(scopes, horizonDays));
        return getJob(jobId);
    }

    UUID submit(AsyncJobType type, String requestId, Supplier<BatchForecastResponse> task) {
        BatchJob job = new BatchJob(UUID.randomUUID(), type, requestId, clock.instant());
        jobs.put(job.id, job);
        evictFinishedIfNeeded();

        log.info("Job queued | id={} | type={} | requestId={}", job.id, type, requestId);
        CompletableFuture.runAsync(() -> run(job, task), executor);
        return job.id;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        BatchJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job.snapshot();
    }

    private void run(BatchJob job, Supplier<BatchForecastResponse> task) {
        job.started(clock.instant());
        try {
            BatchForecastResponse result = task.get();
            job.completed(clock.instant(), result);
            log.info("Job completed | id={} | type={} | succeeded={} | failed={}",
                     job.id, job.type, result.getSucceeded(), result.getFailed());
        } catch (DemandEngineException ex) {
            job.failed(clock.instant(), ex.getErrorCode() + ": " + ex.getMessage());
            log.warn("Job failed | id={} | type={} | code={} | reason={}",
                     job.id, job.type, ex.getErrorCode(), ex.getMessage());
        } catch (RuntimeException ex) {
            job.failed(clock.instant(), ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            log.error("Job failed unexpectedly | id={} | type={}", job.id, job.type, ex);
        }
    }

    private void evictFinishedIfNeeded() {
        int excess = jobs.size() - maxRetained;
        if (excess <= 0) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().isFinished())
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(excess)
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class BatchJob {
        private final UUID id;
        private final AsyncJobType type;
        private final String requestId;
        private final Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private String message = "Queued";
        private BatchForecastResponse result;

        private BatchJob(UUID id, AsyncJobType type, String requestId, Instant createdAt) {
            this.id = id;
            this.type = type;
            this.requestId = requestId;
            this.createdAt = createdAt;
        }

        private synchronized boolean isFinished() {
            return status == AsyncJobStatus.COMPLETED || status == AsyncJobStatus.FAILED;
        }

        private synchronized void started(Instant at) {
            startedAt = at;
            status = AsyncJobStatus.RUNNING;
            message = "Running";
        }

        private synchronized void completed(Instant at, BatchForecastResponse value) {
            completedAt = at;
            result = value;
            status = AsyncJobStatus.COMPLETED;
            message = "Completed";
        }

        private synchronized void failed(Instant at, String reason) {
            completedAt = at;
            status = AsyncJobStatus.FAILED;
            message = reason;
        }

        private synchronized AsyncJobResponse snapshot() {
            return AsyncJobResponse.builder()
                .jobId(id)
                .jobType(type)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .progressPercent(progressPercent())
                .message(message)
                .result(result)
                .requestId(requestId)
                .build();
        }

        private int progressPercent() {
            return switch (status) {
                case QUEUED -> 0;
                case RUNNING -> 5;
                case COMPLETED, FAILED -> 100;
            };
        }
    }
}
