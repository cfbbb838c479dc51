package com.demandengine.repository;

import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.PatternType;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalPattern;
import com.demandengine.engine.model.SeasonalProfile;
import com.demandengine.engine.model.TrendDirection;
import com.demandengine.entity.DemandObservationRecord;
import com.demandengine.entity.ForecastRecord;
import com.demandengine.entity.SeasonalPatternRecord;
import com.demandengine.exception.ForecastImmutableException;
import com.demandengine.exception.ForecastNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaSeriesRepository implements SeriesRepository {

    private final DemandObservationRepository observations;
    private final ForecastRecordRepository forecasts;
    private final SeasonalPatternRecordRepository patterns;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<Observation> findObservations(ScopeId scope, LocalDate from, LocalDate to) {
        return observations
            .findByScopeKeyAndObservationDateBetweenOrderByObservationDateAsc(scope.key(), from, to)
            .stream()
            .map(r -> new Observation(r.getObservationDate(), r.getObservedDemand(), r.isImputed()))
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Forecast> findForecasts(ScopeId scope, LocalDate from, LocalDate to) {
        return forecasts
            .findByScopeKeyAndForecastDateBetweenOrderByForecastDateAscHorizonDaysAsc(scope.key(), from, to)
            .stream()
            .map(this::toForecast)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Forecast> findForecast(UUID id) {
        return forecasts.findById(id).map(this::toForecast);
    }

    @Override
    @Transactional
    public List<Forecast> saveForecasts(List<Forecast> run) {
        if (run.isEmpty()) {
            return List.of();
        }
        Map<String, List<Forecast>> byScopeAndHorizon = run.stream()
            .collect(Collectors.groupingBy(f -> f.getScope().key() + "#" + f.getHorizonDays(),
                LinkedHashMap::new, Collectors.toList()));

        List<ForecastRecord> toSave = new ArrayList<>(run.size());
        List<Forecast> sources = new ArrayList<>(run.size());
        for (List<Forecast> group : byScopeAndHorizon.values()) {
            Forecast first = group.get(0);
            List<LocalDate> dates = group.stream().map(Forecast::getForecastDate).toList();
            Map<LocalDate, ForecastRecord> existing = forecasts
                .findByScopeKeyAndHorizonDaysAndForecastDateIn(first.getScope().key(), first.getHorizonDays(), dates)
                .stream()
                .collect(Collectors.toMap(ForecastRecord::getForecastDate, Function.identity()));

            existing.values().stream()
                .filter(ForecastRecord::isScored)
                .min(Comparator.comparing(ForecastRecord::getForecastDate))
                .ifPresent(scored -> {
                    throw new ForecastImmutableException(scored.getScopeKey(), scored.getForecastDate(), scored.getHorizonDays());
                });

            for (Forecast f : group) {
                ForecastRecord record = existing.get(f.getForecastDate());
                if (record == null) {
                    record = new ForecastRecord();
                    record.setScopeKey(f.getScope().key());
                    record.setTenantId(f.getScope().tenantId());
                    record.setProductId(f.getScope().productId());
                    record.setForecastDate(f.getForecastDate());
                    record.setHorizonDays(f.getHorizonDays());
                }
                apply(record, f);
                toSave.add(record);
                sources.add(f);
            }
            if (!existing.isEmpty()) {
                log.debug("Superseding pending forecasts | scope={} | horizon={} | count={}",
                          first.getScope(), first.getHorizonDays(), existing.size());
            }
        }

        List<ForecastRecord> saved = forecasts.saveAll(toSave);
        List<Forecast> result = new ArrayList<>(saved.size());
        for (int i = 0; i < saved.size(); i++) {
            // recommendations are not stored
            result.add(toForecast(saved.get(i)).toBuilder()
                .recommendations(sources.get(i).getRecommendations())
                .build());
        }
        return result;
    }

    @Override
    @Transactional
    public Forecast saveScored(Forecast forecast) {
        ForecastRecord record = forecasts.findById(forecast.getId())
            .orElseThrow(() -> new ForecastNotFoundException(forecast.getId()));
        if (record.isScored()) {
            throw new ForecastImmutableException(record.getId());
        }
        record.setObservedActual(forecast.getObservedActual());
        record.setAccuracyScore(forecast.getAccuracyScore());
        record.setScoredAt(clock.instant());
        return toForecast(forecasts.save(record));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Forecast> findScoredForecasts(ScopeId scope, LocalDate from, LocalDate to) {
        return forecasts.findScored(scope.key(), from, to).stream().map(this::toForecast).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Forecast> findPendingForecasts(ScopeId scope, LocalDate upTo) {
        return forecasts.findPending(scope.key(), upTo).stream().map(this::toForecast).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SeasonalProfile> findPatterns(ScopeId scope) {
        List<SeasonalPatternRecord> records = patterns.findByScopeKeyOrderByPatternTypeAscPeriodIndexAsc(scope.key());
        if (records.isEmpty()) {
            return Optional.empty();
        }
        List<SeasonalPattern> weekly = new ArrayList<>();
        List<SeasonalPattern> monthly = new ArrayList<>();
        for (SeasonalPatternRecord r : records) {
            SeasonalPattern pattern = toPattern(scope, r);
            (pattern.getPatternType() == PatternType.WEEKLY ? weekly : monthly).add(pattern);
        }
        Instant computedAt = records.stream()
            .map(SeasonalPatternRecord::getComputedAt)
            .min(Comparator.naturalOrder())
            .orElseThrow();
        return Optional.of(SeasonalProfile.builder()
            .scope(scope)
            .computedAt(computedAt)
            .weekly(weekly)
            .monthly(monthly)
            .build());
    }

    @Override
    @Transactional
    public SeasonalProfile replacePatterns(SeasonalProfile profile) {
        ScopeId scope = profile.getScope();
        int removed = patterns.deleteByScope(scope.key());
        patterns.saveAll(profile.all().stream()
            .map(p -> SeasonalPatternRecord.builder()
                .scopeKey(scope.key())
                .tenantId(scope.tenantId())
                .productId(scope.productId())
                .patternType(p.getPatternType().name())
                .periodIndex(p.getPeriodIndex())
                .demandMultiplier(p.getDemandMultiplier())
                .confidenceScore(p.getConfidenceScore())
                .sampleSize(p.getSampleSize())
                .computedAt(profile.getComputedAt())
                .build())
            .toList());
        log.debug("Patterns replaced | scope={} | removed={} | stored={}", scope, removed, profile.all().size());
        return profile;
    }

    private static void apply(ForecastRecord record, Forecast f) {
        record.setLeadDay(f.getLeadDay());
        record.setMethod(f.getMethod());
        record.setPredictedDemand(f.getPredictedDemand());
        record.setConfidenceLower(f.getConfidenceLower());
        record.setConfidenceUpper(f.getConfidenceUpper());
        record.setConfidenceScore(f.getConfidenceScore());
        record.setInsufficientHistory(f.isInsufficientHistory());
        record.setTrend(f.getTrend() != null ? f.getTrend().name() : null);
        record.setGeneratedAt(f.getGeneratedAt());
    }

    private Forecast toForecast(ForecastRecord r) {
        return Forecast.builder()
            .id(r.getId())
            .scope(ScopeId.of(r.getTenantId(), r.getProductId()))
            .forecastDate(r.getForecastDate())
            .horizonDays(r.getHorizonDays())
            .leadDay(r.getLeadDay())
            .method(r.getMethod())
            .predictedDemand(r.getPredictedDemand())
            .confidenceLower(r.getConfidenceLower())
            .confidenceUpper(r.getConfidenceUpper())
            .confidenceScore(r.getConfidenceScore())
            .generatedAt(r.getGeneratedAt())
            .observedActual(r.getObservedActual())
            .accuracyScore(r.getAccuracyScore())
            .insufficientHistory(r.isInsufficientHistory())
            .trend(r.getTrend() != null ? TrendDirection.valueOf(r.getTrend()) : null)
            .build();
    }

    private static SeasonalPattern toPattern(ScopeId scope, SeasonalPatternRecord r) {
        return SeasonalPattern.builder()
            .scope(scope)
            .patternType(PatternType.valueOf(r.getPatternType()))
            .periodIndex(r.getPeriodIndex())
            .demandMultiplier(r.getDemandMultiplier())
            .confidenceScore(r.getConfidenceScore())
            .sampleSize(r.getSampleSize())
            .computedAt(r.getComputedAt())
            .build();
    }
}
