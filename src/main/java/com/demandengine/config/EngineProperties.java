package com.demandengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Policy constants of the forecasting engine, bound from {@code engine.*}.
 * Every value has a default so the engine runs without any configuration.
 */
@ConfigurationProperties(prefix = "engine")
public record EngineProperties(
        @DefaultValue Prediction prediction,
        @DefaultValue Seasonal seasonal,
        @DefaultValue Accuracy accuracy,
        @DefaultValue Anomaly anomaly,
        @DefaultValue Surge surge,
        @DefaultValue Staffing staffing,
        @DefaultValue Batch batch,
        @DefaultValue History history
) {

    public static EngineProperties defaults() {
        return new EngineProperties(
                Prediction.defaults(), Seasonal.defaults(), Accuracy.defaults(), Anomaly.defaults(),
                Surge.defaults(), Staffing.defaults(), Batch.defaults(), History.defaults());
    }

    public EngineProperties withPrediction(Prediction prediction) {
        return new EngineProperties(prediction, seasonal, accuracy, anomaly, surge, staffing, batch, history);
    }

    public EngineProperties withSurge(Surge surge) {
        return new EngineProperties(prediction, seasonal, accuracy, anomaly, surge, staffing, batch, history);
    }

    public EngineProperties withStaffing(Staffing staffing) {
        return new EngineProperties(prediction, seasonal, accuracy, anomaly, surge, staffing, batch, history);
    }

    public EngineProperties withBatch(Batch batch) {
        return new EngineProperties(prediction, seasonal, accuracy, anomaly, surge, staffing, batch, history);
    }

    /**
     * @param window             k, number of most recent observations in the weighted moving average
     * @param minHistory         below this many observations the forecast carries zero confidence
     * @param wideningFactor     interval half-width grows by {@code 1 + wideningFactor * leadDay}; tunable
     * @param intervalZ          multiplier applied to the residual standard deviation
     * @param fullConfidenceHistory history length at which thin-history damping stops
     * @param maxConfidence      confidence ceiling for the first forecast day
     * @param trendWindow        observations used for the trend direction slope
     * @param trendTolerance     slopes within +/- this value are reported as stable
     * @param maxHorizon         largest accepted horizon in days
     * @param applyMonthlySeasonality whether a detected monthly pattern adjusts the forecast
     */
    public record Prediction(
            @DefaultValue("14") int window,
            @DefaultValue("3") int minHistory,
            @DefaultValue("0.1") double wideningFactor,
            @DefaultValue("1.96") double intervalZ,
            @DefaultValue("28") int fullConfidenceHistory,
            @DefaultValue("0.95") double maxConfidence,
            @DefaultValue("7") int trendWindow,
            @DefaultValue("0.1") double trendTolerance,
            @DefaultValue("365") int maxHorizon,
            @DefaultValue("true") boolean applyMonthlySeasonality
    ) {
        public Prediction {
            requirePositive(window, "engine.prediction.window");
            requirePositive(minHistory, "engine.prediction.min-history");
            requirePositive(fullConfidenceHistory, "engine.prediction.full-confidence-history");
            requirePositive(trendWindow, "engine.prediction.trend-window");
            requirePositive(maxHorizon, "engine.prediction.max-horizon");
            if (wideningFactor < 0 || intervalZ < 0) {
                throw new IllegalArgumentException("engine.prediction widening-factor and interval-z must be >= 0");
            }
            if (maxConfidence <= 0 || maxConfidence > 1) {
                throw new IllegalArgumentException("engine.prediction.max-confidence must be in (0, 1]");
            }
        }

        public static Prediction defaults() {
            return new Prediction(14, 3, 0.1, 1.96, 28, 0.95, 7, 0.1, 365, true);
        }
    }

    public record Seasonal(
            @DefaultValue("56") int minWeeklyDays,
            @DefaultValue("12") int minMonthlyMonths,
            @DefaultValue("0.01") double minMultiplier,
            @DefaultValue("24h") Duration refreshInterval
    ) {
        public Seasonal {
            requirePositive(minWeeklyDays, "engine.seasonal.min-weekly-days");
            requirePositive(minMonthlyMonths, "engine.seasonal.min-monthly-months");
            if (minMultiplier <= 0) {
                throw new IllegalArgumentException("engine.seasonal.min-multiplier must be > 0");
            }
        }

        public static Seasonal defaults() {
            return new Seasonal(56, 12, 0.01, Duration.ofHours(24));
        }
    }

    public record Accuracy(@DefaultValue("0.10") double tolerance) {
        public Accuracy {
            if (tolerance < 0) {
                throw new IllegalArgumentException("engine.accuracy.tolerance must be >= 0");
            }
        }

        public static Accuracy defaults() {
            return new Accuracy(0.10);
        }
    }

    /**
     * {@code flatDeparture} and {@code flatMinDelta} apply when the trailing window has
     * no spread: a point is reported only if {@code |x - level| / max(level, 1)} exceeds
     * the former and {@code |x - level|} exceeds the latter.
     */
    public record Anomaly(
            @DefaultValue("14") int window,
            @DefaultValue("7") int minWindow,
            @DefaultValue("2.0") double zMedium,
            @DefaultValue("3.0") double zHigh,
            @DefaultValue("0.30") double seasonalThreshold,
            @DefaultValue("0.60") double seasonalMedium,
            @DefaultValue("1.00") double seasonalHigh,
            @DefaultValue("7") int trendWindow,
            @DefaultValue("0.5") double trendThreshold,
            @DefaultValue("0.5") double trendMinRSquared,
            @DefaultValue("0.01") double trendFlatTolerance,
            @DefaultValue("0.5") double flatDeparture,
            @DefaultValue("1.0") double flatMinDelta
    ) {
        public Anomaly {
            requirePositive(window, "engine.anomaly.window");
            requirePositive(minWindow, "engine.anomaly.min-window");
            if (minWindow > window) {
                throw new IllegalArgumentException("engine.anomaly.min-window must not exceed engine.anomaly.window");
            }
            if (trendWindow < 2) {
                throw new IllegalArgumentException("engine.anomaly.trend-window must be >= 2");
            }
            if (!(zMedium > 0 && zHigh >= zMedium)) {
                throw new IllegalArgumentException("engine.anomaly z thresholds must satisfy 0 < z-medium <= z-high");
            }
            if (!(seasonalThreshold > 0 && seasonalMedium >= seasonalThreshold && seasonalHigh >= seasonalMedium)) {
                throw new IllegalArgumentException("engine.anomaly seasonal bands must be positive and ascending");
            }
            if (flatDeparture < 0 || flatMinDelta < 0) {
                throw new IllegalArgumentException("engine.anomaly flat-departure and flat-min-delta must be >= 0");
            }
        }

        public static Anomaly defaults() {
            return new Anomaly(14, 7, 2.0, 3.0, 0.30, 0.60, 1.00, 7, 0.5, 0.5, 0.01, 0.5, 1.0);
        }
    }

    /**
     * Surge bands are expressed as multiples of the baseline:
     * low from {@code threshold}, medium from {@code mediumBand}, high above {@code highBand}.
     */
    public record Surge(
            @DefaultValue("1.5") double threshold,
            @DefaultValue("2.0") double mediumBand,
            @DefaultValue("3.0") double highBand,
            @DefaultValue("28") int baselineWindow
    ) {
        public Surge {
            if (!(threshold > 0 && mediumBand >= threshold && highBand >= mediumBand)) {
                throw new IllegalArgumentException("engine.surge bands must satisfy 0 < threshold <= medium-band <= high-band");
            }
            requirePositive(baselineWindow, "engine.surge.baseline-window");
        }

        public static Surge defaults() {
            return new Surge(1.5, 2.0, 3.0, 28);
        }
    }

    public record Staffing(Map<String, Role> roles) {
        public Staffing {
            roles = roles == null || roles.isEmpty() ? defaultRoles() : Map.copyOf(roles);
        }

        public static Staffing defaults() {
            return new Staffing(null);
        }

        private static Map<String, Role> defaultRoles() {
            Map<String, Role> roles = new LinkedHashMap<>();
            roles.put("lab-technician", new Role(15.0, 1));
            roles.put("engineer", new Role(25.0, 1));
            return roles;
        }
    }

    public record Role(double unitsPerWorkerPerDay, @DefaultValue("0") int minimumStaff) {
        public Role {
            if (unitsPerWorkerPerDay <= 0) {
                throw new IllegalArgumentException("units-per-worker-per-day must be > 0");
            }
            if (minimumStaff < 0) {
                throw new IllegalArgumentException("minimum-staff must be >= 0");
            }
        }
    }

    public record Batch(
            @DefaultValue("4") int concurrency,
            @DefaultValue("256") int maxSize
    ) {
        public Batch {
            requirePositive(concurrency, "engine.batch.concurrency");
            requirePositive(maxSize, "engine.batch.max-size");
        }

        public static Batch defaults() {
            return new Batch(4, 256);
        }
    }

    public record History(@DefaultValue("730") int lookbackDays) {
        public History {
            requirePositive(lookbackDays, "engine.history.lookback-days");
        }

        public static History defaults() {
            return new History(730);
        }
    }

    private static void requirePositive(int value, String key) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be > 0");
        }
    }
}
