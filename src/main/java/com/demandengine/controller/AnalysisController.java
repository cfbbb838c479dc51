package com.demandengine.controller;

import com.demandengine.dto.AnomalyReport;
import com.demandengine.dto.RealtimeCheckRequest;
import com.demandengine.dto.StaffingRequest;
import com.demandengine.engine.model.AnomalyMethod;
import com.demandengine.engine.model.RealtimeAssessment;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalProfile;
import com.demandengine.engine.model.StaffingRecommendation;
import com.demandengine.service.ForecastInsightsService;
import com.demandengine.service.ForecastOrchestrator;
import com.demandengine.service.SeasonalPatternService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private final SeasonalPatternService patternService;
    private final ForecastInsightsService insightsService;
    private final ForecastOrchestrator orchestrator;

    @PostMapping("/patterns/refresh")
    public ResponseEntity<SeasonalProfile> refreshPatterns(
            @RequestParam String tenantId, @RequestParam(required = false) String productId) {
        log.info("POST /patterns/refresh | tenant={} | product={}", tenantId, productId);
        return ResponseEntity.ok(patternService.refresh(ScopeId.of(tenantId, productId)));
    }

    @GetMapping("/patterns")
    public ResponseEntity<SeasonalProfile> patterns(
            @RequestParam String tenantId, @RequestParam(required = false) String productId) {
        return ResponseEntity.ok(patternService.currentProfile(ScopeId.of(tenantId, productId)));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<AnomalyReport> anomalies(
            @RequestParam String tenantId,
            @RequestParam(required = false) String productId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) Set<AnomalyMethod> methods) {
        return ResponseEntity.ok(insightsService.anomalies(ScopeId.of(tenantId, productId), from, to, methods));
    }

    @PostMapping("/anomalies/check")
    public ResponseEntity<RealtimeAssessment> check(@Valid @RequestBody RealtimeCheckRequest request) {
        ScopeId scope = ScopeId.of(request.getTenantId(), request.getProductId());
        return ResponseEntity.ok(insightsService.check(scope, request.getCurrentValue(), request.getSensitivity()));
    }

    @PostMapping("/staffing")
    public ResponseEntity<StaffingRecommendation> staffing(@Valid @RequestBody StaffingRequest request) {
        return ResponseEntity.ok(orchestrator.staffing(request.getDate(), request.getPredictedDemand()));
    }
}
