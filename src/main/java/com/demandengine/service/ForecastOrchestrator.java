package com.demandengine.service;

import com.demandengine.config.EngineProperties;
import com.demandengine.dto.BatchForecastResponse;
import com.demandengine.dto.BatchItemResult;
import com.demandengine.dto.ForecastBundle;
import com.demandengine.dto.ScopeRef;
import com.demandengine.engine.DemandPredictor;
import com.demandengine.engine.StaffingCalculator;
import com.demandengine.engine.SurgeIdentifier;
import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalProfile;
import com.demandengine.engine.model.StaffingRecommendation;
import com.demandengine.engine.model.SurgePeriod;
import com.demandengine.exception.BatchSizeExceededException;
import com.demandengine.exception.DemandEngineException;
import com.demandengine.exception.InvalidHorizonException;
import com.demandengine.exception.NoDataException;
import com.demandengine.repository.SeriesRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Runs forecast generation per scope: history, seasonal snapshot, prediction,
 * persistence, then surges and staffing. Generation for one scope is serialised
 * by {@link ScopeLocks}; different scopes run in parallel up to the configured
 * batch concurrency.
 */
@Slf4j
@Service
public class ForecastOrchestrator {

    private final SeriesRepository repository;
    private final ObservationHistoryService history;
    private final SeasonalPatternService patterns;
    private final DemandPredictor predictor;
    private final SurgeIdentifier surgeIdentifier;
    private final StaffingCalculator staffingCalculator;
    private final EngineProperties properties;
    private final ScopeLocks scopeLocks;
    private final Clock clock;

    public ForecastOrchestrator(SeriesRepository repository, ObservationHistoryService history,
                                SeasonalPatternService patterns, DemandPredictor predictor,
                                SurgeIdentifier surgeIdentifier, StaffingCalculator staffingCalculator,
                                EngineProperties properties, ScopeLocks scopeLocks, Clock clock) {
        this.repository = repository;
        this.history = history;
        this.patterns = patterns;
        this.predictor = predictor;
        this.surgeIdentifier = surgeIdentifier;
        this.staffingCalculator = staffingCalculator;
        this.properties = properties;
        this.scopeLocks = scopeLocks;
        this.clock = clock;
    }

    /**
     * Forecasts {@code horizonDays} days starting tomorrow. Pending forecasts of an
     * earlier run with the same horizon are superseded; if one of them was scored
     * the whole run is rejected.
     */
    public ForecastBundle generate(ScopeId scope, int horizonDays) {
        validateHorizon(horizonDays);
        return scopeLocks.withLock(scope, () -> generateLocked(scope, horizonDays));
    }

    /** Rejects a batch as a whole when its horizon or its size is out of bounds. */
    public void validateBatch(List<ScopeRef> scopes, int horizonDays) {
        validateHorizon(horizonDays);
        int maxSize = properties.batch().maxSize();
        if (scopes.size() > maxSize) {
            throw new BatchSizeExceededException(scopes.size(), maxSize);
        }
    }

    public Flux<BatchItemResult> generateBatch(List<ScopeRef> scopes, int horizonDays) {
        validateBatch(scopes, horizonDays);
        return Flux.fromIterable(scopes)
            .flatMapSequential(ref -> Mono.fromCallable(() -> generate(ScopeId.of(ref.getTenantId(), ref.getProductId()), horizonDays))
                    .subscribeOn(Schedulers.boundedElastic())
                    .map(bundle -> BatchItemResult.succeeded(ref, bundle))
                    .onErrorResume(ex -> Mono.just(failed(ref, ex))),
                properties.batch().concurrency());
    }

    public Mono<BatchForecastResponse> generateBatchResponse(List<ScopeRef> scopes, int horizonDays) {
        return generateBatch(scopes, horizonDays)
            .collectList()
            .map(results -> {
                BatchForecastResponse response = BatchForecastResponse.of(results);
                log.info("Batch forecast finished | requested={} | succeeded={} | failed={}",
                         response.getRequested(), response.getSucceeded(), response.getFailed());
                return response;
            });
    }

    public BatchForecastResponse generateBatchBlocking(List<ScopeRef> scopes, int horizonDays) {
        return generateBatchResponse(scopes, horizonDays).block();
    }

    public StaffingRecommendation staffing(LocalDate date, double predictedDemand) {
        return staffingCalculator.recommend(date, predictedDemand);
    }

    private void validateHorizon(int horizonDays) {
        int maxHorizon = properties.prediction().maxHorizon();
        if (horizonDays < 1 || horizonDays > maxHorizon) {
            throw new InvalidHorizonException(horizonDays, maxHorizon);
        }
    }

    private ForecastBundle generateLocked(ScopeId scope, int horizonDays) {
        Instant generatedAt = clock.instant();
        LocalDate firstDate = history.today().plusDays(1);

        List<Observation> series = history.recent(scope);
        if (series.isEmpty()) {
            throw new NoDataException(scope.key());
        }
        SeasonalProfile profile = patterns.currentProfile(scope, series);
        List<Forecast> computed = predictor.predict(scope, series, firstDate, horizonDays, profile, generatedAt);
        List<Forecast> stored = repository.saveForecasts(computed);

        double baseline = surgeIdentifier.baseline(series);
        List<SurgePeriod> surges = surgeIdentifier.identify(scope, stored, baseline);
        List<StaffingRecommendation> staffing = stored.stream()
            .map(f -> staffingCalculator.recommend(f.getForecastDate(), f.getPredictedDemand()))
            .toList();

        Forecast first = stored.get(0);
        log.info("Forecast generated | scope={} | horizon={} | history={} | baseline={} | surges={} | insufficientHistory={}",
                 scope, horizonDays, series.size(), baseline, surges.size(), first.isInsufficientHistory());
        return ForecastBundle.builder()
            .scope(scope)
            .horizonDays(horizonDays)
            .method(predictor.method())
            .generatedAt(generatedAt)
            .historySize(series.size())
            .baseline(baseline)
            .trend(first.getTrend())
            .insufficientHistory(first.isInsufficientHistory())
            .forecasts(stored)
            .patterns(profile)
            .staffing(staffing)
            .surges(surges)
            .build();
    }

    private BatchItemResult failed(ScopeRef ref, Throwable ex) {
        if (ex instanceof DemandEngineException engineEx) {
            log.warn("Batch scope failed | tenant={} | product={} | code={} | reason={}",
                     ref.getTenantId(), ref.getProductId(), engineEx.getErrorCode(), ex.getMessage());
            return BatchItemResult.failed(ref, engineEx.getErrorCode(), ex.getMessage());
        }
        log.error("Batch scope failed unexpectedly | tenant={} | product={}", ref.getTenantId(), ref.getProductId(), ex);
        return BatchItemResult.failed(ref, "INTERNAL_ERROR", "An unexpected error occurred");
    }
}
