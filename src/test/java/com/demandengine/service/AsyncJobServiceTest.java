package com.demandengine.service;

import com.demandengine.dto.AsyncJobResponse;
import com.demandengine.dto.AsyncJobStatus;
import com.demandengine.dto.AsyncJobType;
import com.demandengine.dto.BatchForecastResponse;
import com.demandengine.dto.BatchItemResult;
import com.demandengine.dto.ScopeRef;
import com.demandengine.exception.InvalidHorizonException;
import com.demandengine.exception.JobNotFoundException;
import com.demandengine.exception.NoDataException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AsyncJobServiceTest {

    private static final List<ScopeRef> SCOPES = List.of(ScopeRef.builder().tenantId("lab-1").build());

    @Mock
    private ForecastOrchestrator orchestrator;

    private AsyncJobService service;

    @BeforeEach
    void setUp() {
        service = new AsyncJobService(orchestrator, Clock.systemUTC());
        ReflectionTestUtils.setField(service, "poolSize", 2);
        ReflectionTestUtils.setField(service, "maxRetained", 2);
        service.init();
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void submitBatchForecast_completedJobCarriesBatchResult() throws Exception {
        BatchForecastResponse batch = BatchForecastResponse.of(List.of());
        when(orchestrator.generateBatchBlocking(SCOPES, 14)).thenReturn(batch);

        AsyncJobResponse queued = service.submitBatchForecast(SCOPES, 14, "req-1");
        AsyncJobResponse job = awaitFinished(queued.getJobId());

        assertThat(queued.getJobType()).isEqualTo(AsyncJobType.FORECAST_BATCH);
        assertThat(job.getStatus()).isEqualTo(AsyncJobStatus.COMPLETED);
        assertThat(job.getResult()).isSameAs(batch);
        assertThat(job.getProgressPercent()).isEqualTo(100);
        assertThat(job.getRequestId()).isEqualTo("req-1");
        assertThat(job.getCompletedAt()).isNotNull();
        verify(orchestrator).validateBatch(SCOPES, 14);
    }

    @Test
    void submitBatchForecast_invalidHorizon_registersNoJob() {
        doThrow(new InvalidHorizonException(0, 365)).when(orchestrator).validateBatch(SCOPES, 0);

        assertThatThrownBy(() -> service.submitBatchForecast(SCOPES, 0, "req-3"))
            .isInstanceOf(InvalidHorizonException.class);

        verify(orchestrator, never()).generateBatchBlocking(anyList(), anyInt());
        @SuppressWarnings("unchecked")
        Map<UUID, ?> jobs = (Map<UUID, ?>) ReflectionTestUtils.getField(service, "jobs");
        assertThat(jobs).isEmpty();
    }

    @Test
    void submit_failedJobCarriesErrorCode() throws Exception {
        UUID jobId = service.submit(AsyncJobType.FORECAST_BATCH, "req-2", () -> {
            throw new NoDataException("acme/*");
        });

        AsyncJobResponse job = awaitFinished(jobId);

        assertThat(job.getStatus()).isEqualTo(AsyncJobStatus.FAILED);
        assertThat(job.getMessage()).startsWith("NO_DATA: ");
        assertThat(job.getResult()).isNull();
    }

    @Test
    void submit_evictsOldestFinishedJobs() throws Exception {
        UUID first = service.submit(AsyncJobType.FORECAST_BATCH, null, () -> batchOf(1));
        awaitFinished(first);
        UUID second = service.submit(AsyncJobType.FORECAST_BATCH, null, () -> batchOf(2));
        awaitFinished(second);
        UUID third = service.submit(AsyncJobType.FORECAST_BATCH, null, () -> batchOf(3));

        assertThatThrownBy(() -> service.getJob(first)).isInstanceOf(JobNotFoundException.class);
        assertThat(service.getJob(second).getStatus()).isEqualTo(AsyncJobStatus.COMPLETED);
        assertThat(awaitFinished(third).getResult().getRequested()).isEqualTo(3);
    }

    @Test
    void getJob_unknownId_raisesNotFound() {
        assertThatThrownBy(() -> service.getJob(UUID.randomUUID())).isInstanceOf(JobNotFoundException.class);
    }

    private static BatchForecastResponse batchOf(int requested) {
        return BatchForecastResponse.builder()
            .requested(requested)
            .results(List.<BatchItemResult>of())
            .build();
    }

    private AsyncJobResponse awaitFinished(UUID jobId) throws InterruptedException {
        for (int i = 0; i < 200; i++) {
            AsyncJobResponse job = service.getJob(jobId);
            if (job.getStatus() == AsyncJobStatus.COMPLETED || job.getStatus() == AsyncJobStatus.FAILED) {
                return job;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("job " + jobId + " did not finish");
    }
}
