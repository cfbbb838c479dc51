package com.demandengine.engine;

import com.demandengine.config.EngineProperties;
import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalProfile;
import com.demandengine.engine.model.TrendDirection;
import com.demandengine.exception.InvalidHorizonException;
import com.demandengine.exception.NoDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Seasonal moving-average forecaster.
 * <p>
 * The level is a linearly weighted moving average of the most recent {@code k}
 * deseasonalised observations (newest weighted highest), or their plain mean when
 * fewer than {@code k} exist. Each future day multiplies the level by the weekday
 * multiplier of the supplied profile. The interval half-width is
 * {@code z * residualStd * (1 + wideningFactor * leadDay)}; the widening factor is
 * a tunable policy value. Confidence decays with lead day and with thin history and
 * is zero below the minimum history, where the forecast is flagged as insufficient.
 */
@Slf4j
@Component
public class DemandPredictor {

    private static final double HIGH_VOLUME_RATIO = 1.3;
    private static final double LOW_CONFIDENCE = 0.7;

    private final EngineProperties.Prediction config;

    public DemandPredictor(EngineProperties properties) {
        this.config = properties.prediction();
    }

    public String method() {
        return Forecast.SEASONAL_MOVING_AVERAGE;
    }

    /**
     * @param history    observations sorted ascending by date
     * @param firstDate  date of lead day 1
     * @param profile    seasonal snapshot for the scope; null means no seasonality
     */
    public List<Forecast> predict(ScopeId scope, List<Observation> history, LocalDate firstDate,
                                  int horizonDays, SeasonalProfile profile, Instant generatedAt) {
        if (horizonDays < 1 || horizonDays > config.maxHorizon()) {
            throw new InvalidHorizonException(horizonDays, config.maxHorizon());
        }
        if (history == null || history.isEmpty()) {
            throw new NoDataException(scope.key());
        }
        SeasonalProfile seasonal = profile != null ? profile : SeasonalProfile.neutral(scope, generatedAt);
        boolean useWeekly = seasonal.hasWeeklyPattern();
        boolean useMonthly = config.applyMonthlySeasonality() && seasonal.hasMonthlyPattern();

        int n = history.size();
        boolean insufficient = n < config.minHistory();
        List<Observation> fitWindow = history.subList(Math.max(0, n - config.window()), n);
        double level = level(fitWindow, seasonal, useWeekly, n >= config.window());
        double residualStd = residualStd(fitWindow, level, seasonal, useWeekly);
        double historyFactor = Math.min(1.0, (double) n / config.fullConfidenceHistory());
        TrendDirection trend = trendDirection(history);
        LocalDate reference = history.get(n - 1).date();

        List<Forecast> forecasts = new ArrayList<>(horizonDays);
        for (int leadDay = 1; leadDay <= horizonDays; leadDay++) {
            LocalDate date = firstDate.plusDays(leadDay - 1L);
            double multiplier = useWeekly ? seasonal.weeklyMultiplier(date) : 1.0;
            if (useMonthly) {
                multiplier *= seasonal.monthlyMultiplier(date) / seasonal.monthlyMultiplier(reference);
            }
            double predicted = Math.max(0.0, level * multiplier);
            double widening = 1.0 + config.wideningFactor() * leadDay;
            double halfWidth = config.intervalZ() * residualStd * widening;
            double confidence = insufficient ? 0.0 : config.maxConfidence() * historyFactor / widening;

            forecasts.add(Forecast.builder()
                .scope(scope)
                .forecastDate(date)
                .horizonDays(horizonDays)
                .leadDay(leadDay)
                .method(method())
                .predictedDemand(SeriesMath.round(predicted))
                .confidenceLower(SeriesMath.round(Math.max(0.0, predicted - halfWidth)))
                .confidenceUpper(SeriesMath.round(predicted + halfWidth))
                .confidenceScore(SeriesMath.round(confidence))
                .generatedAt(generatedAt)
                .insufficientHistory(insufficient)
                .trend(trend)
                .recommendations(recommendations(predicted, level, trend, confidence, insufficient, n))
                .build());
        }
        log.debug("Forecast computed | scope={} | horizon={} | history={} | level={} | residualStd={}",
                  scope, horizonDays, n, level, residualStd);
        return forecasts;
    }

    /** Direction of the least-squares slope over the most recent trend window. */
    public TrendDirection trendDirection(List<Observation> history) {
        List<Observation> recent = history.subList(Math.max(0, history.size() - config.trendWindow()), history.size());
        if (recent.size() < 2) {
            return TrendDirection.STABLE;
        }
        LocalDate origin = recent.get(0).date();
        double[] x = new double[recent.size()];
        double[] y = new double[recent.size()];
        for (int i = 0; i < recent.size(); i++) {
            x[i] = ChronoUnit.DAYS.between(origin, recent.get(i).date());
            y[i] = recent.get(i).demand();
        }
        double slope = SeriesMath.regression(x, y).slope();
        if (slope > config.trendTolerance()) {
            return TrendDirection.INCREASING;
        }
        if (slope < -config.trendTolerance()) {
            return TrendDirection.DECREASING;
        }
        return TrendDirection.STABLE;
    }

    private double level(List<Observation> window, SeasonalProfile seasonal, boolean useWeekly, boolean weighted) {
        double weightedSum = 0.0;
        double weightTotal = 0.0;
        for (int i = 0; i < window.size(); i++) {
            Observation o = window.get(i);
            double weight = weighted ? i + 1.0 : 1.0;
            weightedSum += weight * deseasonalise(o, seasonal, useWeekly);
            weightTotal += weight;
        }
        return weightedSum / weightTotal;
    }

    private double residualStd(List<Observation> window, double level, SeasonalProfile seasonal, boolean useWeekly) {
        double squares = 0.0;
        for (Observation o : window) {
            double fitted = level * (useWeekly ? seasonal.weeklyMultiplier(o.date()) : 1.0);
            squares += (o.demand() - fitted) * (o.demand() - fitted);
        }
        return Math.sqrt(squares / window.size());
    }

    private double deseasonalise(Observation o, SeasonalProfile seasonal, boolean useWeekly) {
        return useWeekly ? o.demand() / seasonal.weeklyMultiplier(o.date()) : o.demand();
    }

    private List<String> recommendations(double predicted, double level, TrendDirection trend,
                                         double confidence, boolean insufficient, int historySize) {
        List<String> hints = new ArrayList<>();
        if (insufficient) {
            hints.add("Insufficient history: forecast is the average of " + historySize + " observation(s)");
            return hints;
        }
        if (predicted > level * HIGH_VOLUME_RATIO) {
            hints.add("High volume expected; pre-stage materials and schedule additional staff");
        }
        if (trend == TrendDirection.INCREASING) {
            hints.add("Upward trend detected; monitor capacity closely");
        }
        if (confidence < LOW_CONFIDENCE) {
            hints.add("Lower confidence; treat this day as indicative only");
        }
        return hints;
    }
}
