package com.demandengine.engine;

import com.demandengine.config.EngineProperties;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.PatternType;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalPattern;
import com.demandengine.engine.model.SeasonalProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Decomposes a demand series into weekday and month multipliers.
 * <p>
 * For each period index the multiplier is the mean demand of that index over the
 * global mean; confidence is {@code 1 - coefficientOfVariation} of the index's
 * sample, clamped to [0, 1]. A series shorter than one full cycle requirement, or
 * with zero mean, yields neutral multipliers with zero confidence.
 */
@Slf4j
@Component
public class SeasonalPatternDetector {

    private final EngineProperties.Seasonal config;

    public SeasonalPatternDetector(EngineProperties properties) {
        this.config = properties.seasonal();
    }

    public SeasonalProfile detect(ScopeId scope, List<Observation> history, Instant computedAt) {
        return SeasonalProfile.builder()
            .scope(scope)
            .computedAt(computedAt)
            .weekly(detect(scope, history, PatternType.WEEKLY, computedAt))
            .monthly(detect(scope, history, PatternType.MONTHLY, computedAt))
            .build();
    }

    public List<SeasonalPattern> detect(
            ScopeId scope, List<Observation> history, PatternType type, Instant computedAt) {
        List<List<Double>> buckets = new ArrayList<>(type.periods());
        for (int i = 0; i < type.periods(); i++) {
            buckets.add(new ArrayList<>());
        }
        double total = 0.0;
        for (Observation o : history) {
            buckets.get(type.periodIndex(o.date())).add(o.demand());
            total += o.demand();
        }
        int[] sampleSizes = buckets.stream().mapToInt(List::size).toArray();

        if (!coversCycle(history, type)) {
            log.debug("Seasonal pattern skipped, not enough history | scope={} | type={} | observations={}",
                      scope, type, history.size());
            return SeasonalProfile.neutralPatterns(scope, type, computedAt, sampleSizes);
        }
        double globalMean = total / history.size();
        if (globalMean == 0.0) {
            return SeasonalProfile.neutralPatterns(scope, type, computedAt, sampleSizes);
        }

        List<SeasonalPattern> patterns = new ArrayList<>(type.periods());
        for (int i = 0; i < type.periods(); i++) {
            List<Double> bucket = buckets.get(i);
            double multiplier = 1.0;
            double confidence = 0.0;
            if (!bucket.isEmpty()) {
                double bucketMean = SeriesMath.mean(bucket);
                double bucketStd = SeriesMath.std(bucket);
                multiplier = Math.max(config.minMultiplier(), bucketMean / globalMean);
                confidence = bucketStd == 0.0 ? 1.0 : SeriesMath.clamp(1.0 - bucketStd / bucketMean, 0.0, 1.0);
            }
            patterns.add(SeasonalPattern.builder()
                .scope(scope)
                .patternType(type)
                .periodIndex(i)
                .demandMultiplier(SeriesMath.round(multiplier))
                .confidenceScore(SeriesMath.round(confidence))
                .sampleSize(bucket.size())
                .computedAt(computedAt)
                .build());
        }
        return patterns;
    }

    private boolean coversCycle(List<Observation> history, PatternType type) {
        if (history.isEmpty()) {
            return false;
        }
        LocalDate first = history.get(0).date();
        LocalDate last = history.get(history.size() - 1).date();
        if (type == PatternType.WEEKLY) {
            return ChronoUnit.DAYS.between(first, last) + 1 >= config.minWeeklyDays();
        }
        return ChronoUnit.MONTHS.between(YearMonth.from(first), YearMonth.from(last)) + 1 >= config.minMonthlyMonths();
    }
}
