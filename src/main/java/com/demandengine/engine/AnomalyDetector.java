package com.demandengine.engine;

import com.demandengine.config.EngineProperties;
import com.demandengine.engine.model.AnomalyFinding;
import com.demandengine.engine.model.AnomalyMethod;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.RealtimeAssessment;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalProfile;
import com.demandengine.engine.model.Sensitivity;
import com.demandengine.engine.model.Severity;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Three independent detectors over an ascending observation series. Each call is a
 * pure function of its arguments; one date may be reported by several methods.
 */
@Component
public class AnomalyDetector {

    private static final double EPS = 1e-9;

    private final EngineProperties.Anomaly config;

    public AnomalyDetector(EngineProperties properties) {
        this.config = properties.anomaly();
    }

    /**
     * Z-score of each point against the trailing window that precedes it. A window
     * with zero spread is not divided by: a point is reported as high only when it
     * departs from the flat level by more than {@code flat-min-delta} units and by more
     * than {@code flat-departure} relative to that level.
     */
    public List<AnomalyFinding> statisticalOutliers(ScopeId scope, List<Observation> series) {
        List<AnomalyFinding> findings = new ArrayList<>();
        for (int i = config.minWindow(); i < series.size(); i++) {
            double[] window = values(series.subList(Math.max(0, i - config.window()), i));
            double mean = SeriesMath.mean(window);
            double std = SeriesMath.std(window);
            Observation o = series.get(i);

            if (std < EPS) {
                if (!departsFromFlat(o.demand(), mean)) {
                    continue;
                }
                findings.add(finding(scope, o, AnomalyMethod.STATISTICAL, mean, mean, Severity.HIGH,
                    String.format(Locale.ROOT, "Demand %.2f departs from a flat trailing level of %.2f",
                        o.demand(), mean)));
                continue;
            }

            double z = (o.demand() - mean) / std;
            Severity severity = Math.abs(z) > config.zHigh() ? Severity.HIGH
                : Math.abs(z) > config.zMedium() ? Severity.MEDIUM : null;
            if (severity != null) {
                findings.add(finding(scope, o, AnomalyMethod.STATISTICAL,
                    Math.max(0.0, mean - config.zMedium() * std), mean + config.zMedium() * std, severity,
                    String.format(Locale.ROOT, "Demand %.2f is %.2f standard deviations from the trailing mean %.2f",
                        o.demand(), z, mean)));
            }
        }
        return findings;
    }

    /**
     * Compares each point with {@code trailingBaseline * weekdayMultiplier}. Returns
     * nothing when the profile carries no detected weekly pattern.
     */
    public List<AnomalyFinding> seasonalDeviations(ScopeId scope, List<Observation> series, SeasonalProfile profile) {
        if (profile == null || !profile.hasWeeklyPattern()) {
            return List.of();
        }
        List<AnomalyFinding> findings = new ArrayList<>();
        for (int i = config.minWindow(); i < series.size(); i++) {
            List<Observation> trailing = series.subList(Math.max(0, i - config.window()), i);
            double baseline = trailing.stream()
                .mapToDouble(t -> t.demand() / profile.weeklyMultiplier(t.date()))
                .average()
                .orElse(0.0);
            Observation o = series.get(i);
            double expected = baseline * profile.weeklyMultiplier(o.date());
            double deviation = Math.abs(o.demand() - expected) / Math.max(expected, 1.0);
            if (deviation <= config.seasonalThreshold()) {
                continue;
            }
            Severity severity = deviation > config.seasonalHigh() ? Severity.HIGH
                : deviation > config.seasonalMedium() ? Severity.MEDIUM : Severity.LOW;
            findings.add(finding(scope, o, AnomalyMethod.SEASONAL,
                Math.max(0.0, expected * (1.0 - config.seasonalThreshold())),
                expected * (1.0 + config.seasonalThreshold()), severity,
                String.format(Locale.ROOT, "Demand %.2f deviates %.0f%% from the seasonal expectation %.2f for %s",
                    o.demand(), deviation * 100.0, expected, o.date().getDayOfWeek())));
        }
        return findings;
    }

    /**
     * Fits a least-squares slope to two adjacent trailing windows at each position and
     * reports the onset of a reversal or of a relative slope change above the
     * threshold. Slopes with a poor fit or a negligible magnitude count as flat, so a
     * single spike does not register as a change of trajectory.
     */
    public List<AnomalyFinding> trendChanges(ScopeId scope, List<Observation> series) {
        int w = config.trendWindow();
        List<AnomalyFinding> findings = new ArrayList<>();
        boolean previousFlagged = false;
        for (int end = 2 * w; end <= series.size(); end++) {
            List<Observation> prior = series.subList(end - 2 * w, end - w);
            List<Observation> recent = series.subList(end - w, end);
            double oldSlope = effectiveSlope(prior);
            double newSlope = effectiveSlope(recent);

            String change = classifyChange(oldSlope, newSlope);
            if (change == null) {
                previousFlagged = false;
                continue;
            }
            if (previousFlagged) {
                continue;
            }
            previousFlagged = true;

            boolean reversal = oldSlope * newSlope < 0;
            double relative = Math.abs(newSlope - oldSlope) / Math.max(Math.abs(oldSlope), EPS);
            Severity severity = reversal ? Severity.HIGH
                : relative >= 2 * config.trendThreshold() ? Severity.MEDIUM : Severity.LOW;
            double[] priorValues = values(prior);
            Observation boundary = recent.get(0);
            findings.add(finding(scope, boundary, AnomalyMethod.TREND,
                min(priorValues), max(priorValues), severity,
                String.format(Locale.ROOT, "Trend %s: slope %.3f/day changed to %.3f/day", change, oldSlope, newSlope)));
        }
        return findings;
    }

    /**
     * Checks one current value against the trailing window of {@code history}.
     */
    public RealtimeAssessment assess(List<Observation> history, double currentValue, Sensitivity sensitivity) {
        double[] window = values(history.subList(Math.max(0, history.size() - config.window()), history.size()));
        double mean = SeriesMath.mean(window);
        double std = SeriesMath.std(window);
        double band = std * sensitivity.sigmas();
        double deviation = Math.abs(currentValue - mean);

        boolean anomaly;
        double z;
        if (std < EPS) {
            anomaly = window.length > 0 && departsFromFlat(currentValue, mean);
            z = anomaly ? Double.POSITIVE_INFINITY : 0.0;
        } else {
            anomaly = deviation > band;
            z = deviation / std;
        }
        Severity severity = z > config.zHigh() ? Severity.HIGH : z > config.zMedium() ? Severity.MEDIUM : Severity.LOW;
        double confidence = Math.min(1.0, z / sensitivity.sigmas());

        String recommendation = null;
        if (anomaly) {
            if (currentValue > mean) {
                recommendation = severity == Severity.HIGH
                    ? "Critical surge detected; call in additional staff immediately"
                    : "Higher than normal volume; monitor closely and prepare backup staff";
            } else {
                recommendation = "Lower than expected volume; investigate upstream causes";
            }
        }
        return RealtimeAssessment.builder()
            .anomaly(anomaly)
            .severity(severity)
            .confidence(SeriesMath.round(confidence))
            .expectedLow(SeriesMath.round(Math.max(0.0, mean - band)))
            .expectedHigh(SeriesMath.round(mean + band))
            .actualValue(currentValue)
            .recommendation(recommendation)
            .build();
    }

    private String classifyChange(double oldSlope, double newSlope) {
        if (oldSlope == 0.0 && newSlope == 0.0) {
            return null;
        }
        if (oldSlope * newSlope < 0) {
            return "reversal";
        }
        if (oldSlope == 0.0) {
            return "emerging";
        }
        double relative = Math.abs(newSlope - oldSlope) / Math.abs(oldSlope);
        if (relative <= config.trendThreshold()) {
            return null;
        }
        if (newSlope == 0.0) {
            return "flattening";
        }
        return Math.abs(newSlope) > Math.abs(oldSlope) ? "acceleration" : "deceleration";
    }

    private double effectiveSlope(List<Observation> window) {
        LocalDate origin = window.get(0).date();
        double[] x = new double[window.size()];
        double[] y = values(window);
        for (int i = 0; i < window.size(); i++) {
            x[i] = ChronoUnit.DAYS.between(origin, window.get(i).date());
        }
        SeriesMath.Regression fit = SeriesMath.regression(x, y);
        double level = Math.max(SeriesMath.mean(y), 1.0);
        if (fit.rSquared() < config.trendMinRSquared() || Math.abs(fit.slope()) < config.trendFlatTolerance() * level) {
            return 0.0;
        }
        return fit.slope();
    }

    private boolean departsFromFlat(double value, double level) {
        double delta = Math.abs(value - level);
        return delta > config.flatMinDelta() && delta / Math.max(level, 1.0) > config.flatDeparture();
    }

    private AnomalyFinding finding(ScopeId scope, Observation o, AnomalyMethod method,
                                   double low, double high, Severity severity, String description) {
        return AnomalyFinding.builder()
            .scope(scope)
            .date(o.date())
            .method(method)
            .observedValue(o.demand())
            .expectedLow(SeriesMath.round(low))
            .expectedHigh(SeriesMath.round(high))
            .severity(severity)
            .description(description)
            .build();
    }

    private static double[] values(List<Observation> observations) {
        return observations.stream().mapToDouble(Observation::demand).toArray();
    }

    private static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return min;
    }

    private static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return max;
    }
}
