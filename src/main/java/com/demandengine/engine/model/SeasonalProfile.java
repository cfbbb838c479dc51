package com.demandengine.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Versioned snapshot of a scope's complete multiplier set. Recomputed wholesale
 * and handed to the predictor explicitly.
 */
@Value
@Builder
public class SeasonalProfile {
    ScopeId scope;
    Instant computedAt;
    List<SeasonalPattern> weekly;
    List<SeasonalPattern> monthly;

    /** Neutral profile: every multiplier 1.0 with zero confidence. */
    public static SeasonalProfile neutral(ScopeId scope, Instant computedAt) {
        return SeasonalProfile.builder()
            .scope(scope)
            .computedAt(computedAt)
            .weekly(neutralPatterns(scope, PatternType.WEEKLY, computedAt, new int[7]))
            .monthly(neutralPatterns(scope, PatternType.MONTHLY, computedAt, new int[12]))
            .build();
    }

    public static List<SeasonalPattern> neutralPatterns(
            ScopeId scope, PatternType type, Instant computedAt, int[] sampleSizes) {
        List<SeasonalPattern> patterns = new ArrayList<>(type.periods());
        for (int i = 0; i < type.periods(); i++) {
            patterns.add(SeasonalPattern.builder()
                .scope(scope).patternType(type).periodIndex(i)
                .demandMultiplier(1.0).confidenceScore(0.0)
                .sampleSize(sampleSizes[i]).computedAt(computedAt)
                .build());
        }
        return patterns;
    }

    public boolean hasWeeklyPattern() {
        return detected(weekly);
    }

    public boolean hasMonthlyPattern() {
        return detected(monthly);
    }

    public double weeklyMultiplier(LocalDate date) {
        return multiplier(weekly, PatternType.WEEKLY, date);
    }

    public double monthlyMultiplier(LocalDate date) {
        return multiplier(monthly, PatternType.MONTHLY, date);
    }

    public List<SeasonalPattern> all() {
        List<SeasonalPattern> all = new ArrayList<>(weekly);
        all.addAll(monthly);
        return all;
    }

    private static boolean detected(List<SeasonalPattern> patterns) {
        return patterns != null && patterns.stream().anyMatch(p -> p.getConfidenceScore() > 0.0);
    }

    private static double multiplier(List<SeasonalPattern> patterns, PatternType type, LocalDate date) {
        if (patterns == null || patterns.isEmpty()) {
            return 1.0;
        }
        int index = type.periodIndex(date);
        return patterns.stream()
            .filter(p -> p.getPeriodIndex() == index)
            .mapToDouble(SeasonalPattern::getDemandMultiplier)
            .findFirst()
            .orElse(1.0);
    }
}
