package com.demandengine.engine;

import com.demandengine.config.EngineProperties;
import com.demandengine.engine.model.AccuracyMetric;
import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.exception.InvalidObservationException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Scores forecasts against observed actuals.
 * <p>
 * Per forecast: {@code relativeError = |actual - predicted| / max(actual, 1)} and
 * {@code accuracyScore = max(0, 1 - relativeError)}. The aggregate MAPE only
 * averages forecasts with a positive actual; MAE and RMSE use every sample.
 */
@Component
public class AccuracyScorer {

    private final EngineProperties.Accuracy config;

    public AccuracyScorer(EngineProperties properties) {
        this.config = properties.accuracy();
    }

    public static double relativeError(double actual, double predicted) {
        return Math.abs(actual - predicted) / Math.max(actual, 1.0);
    }

    public static double accuracyScore(double actual, double predicted) {
        return Math.max(0.0, 1.0 - relativeError(actual, predicted));
    }

    /**
     * Returns the scored copy of {@code forecast}. A forecast that is already
     * scored raises {@link com.demandengine.exception.ForecastImmutableException}.
     */
    public Forecast score(Forecast forecast, double actual) {
        if (!Double.isFinite(actual) || actual < 0) {
            throw new InvalidObservationException("actual demand must be a finite value >= 0 but was " + actual);
        }
        return forecast.scored(actual, SeriesMath.round(accuracyScore(actual, forecast.getPredictedDemand())));
    }

    public AccuracyMetric aggregate(ScopeId scope, LocalDate periodStart, LocalDate periodEnd, List<Forecast> forecasts) {
        List<Forecast> scored = forecasts.stream()
            .filter(f -> f.getObservedActual() != null)
            .toList();
        if (scored.isEmpty()) {
            return AccuracyMetric.builder()
                .scope(scope)
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .sampleSize(0)
                .build();
        }

        double absErrorSum = 0.0;
        double squaredErrorSum = 0.0;
        double apeSum = 0.0;
        int apeCount = 0;
        int withinTolerance = 0;

        for (Forecast f : scored) {
            double actual = f.getObservedActual();
            double predicted = f.getPredictedDemand();
            double error = actual - predicted;
            absErrorSum += Math.abs(error);
            squaredErrorSum += error * error;
            if (actual > 0.0) {
                apeSum += Math.abs(error) / actual;
                apeCount++;
            }
            if (relativeError(actual, predicted) <= config.tolerance()) {
                withinTolerance++;
            }
        }

        double n = scored.size();
        return AccuracyMetric.builder()
            .scope(scope)
            .periodStart(periodStart)
            .periodEnd(periodEnd)
            .sampleSize(scored.size())
            .mae(SeriesMath.round(absErrorSum / n))
            .mape(apeCount > 0 ? SeriesMath.round(apeSum / apeCount) : null)
            .rmse(SeriesMath.round(Math.sqrt(squaredErrorSum / n)))
            .accuracyRateWithinTolerance(SeriesMath.round(withinTolerance / n))
            .build();
    }
}
