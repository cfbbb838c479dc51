package com.demandengine.engine.model;

import com.demandengine.exception.ForecastImmutableException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * One day of a demand forecast. Created pending (no actual) and scored exactly once.
 */
@Value
@Builder(toBuilder = true)
public class Forecast {

    public static final String SEASONAL_MOVING_AVERAGE = "seasonal_moving_average";

    UUID id;
    ScopeId scope;
    LocalDate forecastDate;
    int horizonDays;
    int leadDay;
    String method;
    double predictedDemand;
    double confidenceLower;
    double confidenceUpper;
    double confidenceScore;
    Instant generatedAt;
    Double observedActual;
    Double accuracyScore;
    boolean insufficientHistory;
    TrendDirection trend;
    @Singular
    List<String> recommendations;

    public ForecastStatus getStatus() {
        return accuracyScore != null ? ForecastStatus.SCORED : ForecastStatus.PENDING;
    }

    public boolean isScored() {
        return getStatus() == ForecastStatus.SCORED;
    }

    /** Returns the scored copy; a forecast that already carries a score is rejected. */
    public Forecast scored(double actual, double score) {
        if (isScored()) {
            throw new ForecastImmutableException(id);
        }
        return toBuilder().observedActual(actual).accuracyScore(score).build();
    }
}
