package com.demandengine.service;

import com.demandengine.config.EngineProperties;
import com.demandengine.dto.AnomalyReport;
import com.demandengine.dto.ScoringSummary;
import com.demandengine.engine.AccuracyScorer;
import com.demandengine.engine.AnomalyDetector;
import com.demandengine.engine.model.AccuracyMetric;
import com.demandengine.engine.model.AnomalyFinding;
import com.demandengine.engine.model.AnomalyMethod;
import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.RealtimeAssessment;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalProfile;
import com.demandengine.engine.model.Sensitivity;
import com.demandengine.exception.ForecastNotFoundException;
import com.demandengine.exception.InvalidObservationException;
import com.demandengine.exception.InvalidPeriodException;
import com.demandengine.exception.NoDataException;
import com.demandengine.repository.SeriesRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Operations that run against stored forecasts and observed history, independently
 * of forecast generation: scoring, accuracy, anomaly detection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastInsightsService {

    private static final int DEFAULT_PERIOD_DAYS = 30;

    private final SeriesRepository repository;
    private final ObservationHistoryService history;
    private final SeasonalPatternService patterns;
    private final AccuracyScorer scorer;
    private final AnomalyDetector detector;
    private final EngineProperties properties;

    public Forecast getForecast(UUID id) {
        return repository.findForecast(id).orElseThrow(() -> new ForecastNotFoundException(id));
    }

    public List<Forecast> forecasts(ScopeId scope, LocalDate from, LocalDate to) {
        LocalDate start = from != null ? from : history.today();
        LocalDate end = to != null ? to : start.plusDays(properties.prediction().maxHorizon());
        requireOrdered(start, end);
        return repository.findForecasts(scope, start, end);
    }

    public Forecast recordActual(UUID id, double actualDemand) {
        Forecast forecast = getForecast(id);
        Forecast scored = repository.saveScored(scorer.score(forecast, actualDemand));
        log.info("Forecast scored | id={} | predicted={} | actual={} | accuracy={}",
                 id, scored.getPredictedDemand(), actualDemand, scored.getAccuracyScore());
        return scored;
    }

    /**
     * Scores every pending forecast dated on or before {@code upTo} that has a
     * non-imputed observation for its date. The rest stay pending.
     */
    public ScoringSummary scorePending(ScopeId scope, LocalDate upTo) {
        LocalDate cutOff = upTo != null ? upTo : history.today();
        List<Forecast> pending = repository.findPendingForecasts(scope, cutOff);
        if (pending.isEmpty()) {
            return ScoringSummary.builder()
                .scope(scope).upTo(cutOff).scoredForecasts(List.of())
                .build();
        }
        LocalDate earliest = pending.stream().map(Forecast::getForecastDate).min(Comparator.naturalOrder()).orElse(cutOff);
        Map<LocalDate, Double> actuals = history.between(scope, earliest, cutOff).stream()
            .filter(o -> !o.imputed())
            .collect(Collectors.toMap(Observation::date, Observation::demand, (a, b) -> b));

        List<Forecast> scored = new ArrayList<>();
        for (Forecast forecast : pending) {
            Double actual = actuals.get(forecast.getForecastDate());
            if (actual != null) {
                scored.add(repository.saveScored(scorer.score(forecast, actual)));
            }
        }
        log.info("Pending forecasts scored | scope={} | upTo={} | pending={} | scored={}",
                 scope, cutOff, pending.size(), scored.size());
        return ScoringSummary.builder()
            .scope(scope)
            .upTo(cutOff)
            .pending(pending.size())
            .scored(scored.size())
            .awaitingActual(pending.size() - scored.size())
            .scoredForecasts(scored)
            .build();
    }

    public AccuracyMetric accuracy(ScopeId scope, LocalDate from, LocalDate to) {
        LocalDate end = to != null ? to : history.today();
        LocalDate start = from != null ? from : end.minusDays(DEFAULT_PERIOD_DAYS - 1L);
        requireOrdered(start, end);
        return scorer.aggregate(scope, start, end, repository.findScoredForecasts(scope, start, end));
    }

    /**
     * Runs the requested detectors over {@code [from, to]}. The series is loaded with
     * enough preceding days for the trailing windows; only findings inside the
     * period are reported.
     */
    public AnomalyReport anomalies(ScopeId scope, LocalDate from, LocalDate to, Set<AnomalyMethod> methods) {
        LocalDate end = to != null ? to : history.today();
        LocalDate start = from != null ? from : end.minusDays(DEFAULT_PERIOD_DAYS - 1L);
        requireOrdered(start, end);
        Set<AnomalyMethod> selected = methods == null || methods.isEmpty()
            ? EnumSet.allOf(AnomalyMethod.class) : EnumSet.copyOf(methods);

        EngineProperties.Anomaly config = properties.anomaly();
        int context = Math.max(config.window(), 2 * config.trendWindow());
        List<Observation> series = history.between(scope, start.minusDays(context), end);

        List<AnomalyFinding> findings = new ArrayList<>();
        if (!series.isEmpty()) {
            if (selected.contains(AnomalyMethod.STATISTICAL)) {
                findings.addAll(detector.statisticalOutliers(scope, series));
            }
            if (selected.contains(AnomalyMethod.SEASONAL)) {
                SeasonalProfile profile = patterns.currentProfile(scope);
                findings.addAll(detector.seasonalDeviations(scope, series, profile));
            }
            if (selected.contains(AnomalyMethod.TREND)) {
                findings.addAll(detector.trendChanges(scope, series));
            }
        }
        List<AnomalyFinding> inPeriod = findings.stream()
            .filter(f -> !f.getDate().isBefore(start) && !f.getDate().isAfter(end))
            .sorted(Comparator.comparing(AnomalyFinding::getDate).thenComparing(AnomalyFinding::getMethod))
            .toList();

        log.info("Anomaly scan | scope={} | from={} | to={} | methods={} | findings={}",
                 scope, start, end, selected, inPeriod.size());
        return AnomalyReport.builder()
            .scope(scope)
            .periodStart(start)
            .periodEnd(end)
            .methods(selected)
            .findings(inPeriod)
            .summary(AnomalyReport.Summary.of(selected, inPeriod))
            .build();
    }

    public RealtimeAssessment check(ScopeId scope, double currentValue, Sensitivity sensitivity) {
        if (!Double.isFinite(currentValue) || currentValue < 0) {
            throw new InvalidObservationException("currentValue must be a finite value >= 0 but was " + currentValue);
        }
        List<Observation> series = history.recent(scope);
        if (series.isEmpty()) {
            throw new NoDataException(scope.key());
        }
        RealtimeAssessment assessment = detector.assess(series, currentValue,
            sensitivity != null ? sensitivity : Sensitivity.MEDIUM);
        if (assessment.isAnomaly()) {
            log.info("Realtime anomaly | scope={} | value={} | severity={} | expected=[{}, {}]",
                     scope, currentValue, assessment.getSeverity(),
                     assessment.getExpectedLow(), assessment.getExpectedHigh());
        }
        return assessment;
    }

    private static void requireOrdered(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new InvalidPeriodException(from, to);
        }
    }
}
