package com.demandengine.controller;

import com.demandengine.config.RequestIdFilter;
import com.demandengine.dto.AsyncJobResponse;
import com.demandengine.dto.BatchForecastRequest;
import com.demandengine.dto.BatchForecastResponse;
import com.demandengine.dto.ForecastBundle;
import com.demandengine.dto.ForecastRequest;
import com.demandengine.dto.ScoringSummary;
import com.demandengine.engine.model.AccuracyMetric;
import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.service.AsyncJobService;
import com.demandengine.service.ForecastInsightsService;
import com.demandengine.service.ForecastOrchestrator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastOrchestrator orchestrator;
    private final ForecastInsightsService insightsService;
    private final AsyncJobService asyncJobService;

    @PostMapping("/forecasts")
    public ResponseEntity<ForecastBundle> forecast(@Valid @RequestBody ForecastRequest request) {
        log.info("POST /forecasts | tenant={} | product={} | horizon={}",
                 request.getTenantId(), request.getProductId(), request.getHorizonDays());
        ScopeId scope = ScopeId.of(request.getTenantId(), request.getProductId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(orchestrator.generate(scope, request.getHorizonDays()));
    }

    @PostMapping("/forecasts/batch")
    public Mono<ResponseEntity<BatchForecastResponse>> forecastBatch(@Valid @RequestBody BatchForecastRequest request) {
        log.info("POST /forecasts/batch | count={} | horizon={}", request.getScopes().size(), request.getHorizonDays());
        return orchestrator.generateBatchResponse(request.getScopes(), request.getHorizonDays())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/forecasts/async")
    public ResponseEntity<AsyncJobResponse> forecastAsync(
            @Valid @RequestBody BatchForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        AsyncJobResponse job = asyncJobService.submitBatchForecast(
            request.getScopes(), request.getHorizonDays(), requestId);
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/jobs/" + job.getJobId())
            .body(job);
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @GetMapping("/forecasts")
    public ResponseEntity<List<Forecast>> forecasts(
            @RequestParam String tenantId,
            @RequestParam(required = false) String productId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(insightsService.forecasts(ScopeId.of(tenantId, productId), from, to));
    }

    @GetMapping("/forecasts/{id}")
    public ResponseEntity<Forecast> forecastById(@PathVariable UUID id) {
        return ResponseEntity.ok(insightsService.getForecast(id));
    }

    @PatchMapping("/forecasts/{id}/actual")
    public ResponseEntity<Forecast> recordActual(@PathVariable UUID id, @RequestParam double actualDemand) {
        log.info("PATCH /forecasts/{}/actual | actualDemand={}", id, actualDemand);
        return ResponseEntity.ok(insightsService.recordActual(id, actualDemand));
    }

    @PostMapping("/forecasts/score-pending")
    public ResponseEntity<ScoringSummary> scorePending(
            @RequestParam String tenantId,
            @RequestParam(required = false) String productId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate upTo) {
        return ResponseEntity.ok(insightsService.scorePending(ScopeId.of(tenantId, productId), upTo));
    }

    @GetMapping("/forecasts/accuracy")
    public ResponseEntity<AccuracyMetric> accuracy(
            @RequestParam String tenantId,
            @RequestParam(required = false) String productId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(insightsService.accuracy(ScopeId.of(tenantId, productId), from, to));
    }
}
