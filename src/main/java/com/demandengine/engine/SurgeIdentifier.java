package com.demandengine.engine;

import com.demandengine.config.EngineProperties;
import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.Observation;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.Severity;
import com.demandengine.engine.model.SurgePeriod;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds runs of consecutive forecast days above {@code baseline * threshold} and
 * grades each run by its peak-to-baseline ratio.
 */
@Component
public class SurgeIdentifier {

    private final EngineProperties.Surge config;

    public SurgeIdentifier(EngineProperties properties) {
        this.config = properties.surge();
    }

    /** Mean demand of the most recent baseline window. */
    public double baseline(List<Observation> history) {
        return SeriesMath.round(history.subList(Math.max(0, history.size() - config.baselineWindow()), history.size())
            .stream()
            .mapToDouble(Observation::demand)
            .average()
            .orElse(0.0));
    }

    public List<SurgePeriod> identify(ScopeId scope, List<Forecast> forecasts, double baseline) {
        if (baseline <= 0.0) {
            return List.of();
        }
        double limit = baseline * config.threshold();
        List<SurgePeriod> surges = new ArrayList<>();
        int runStart = -1;
        for (int i = 0; i <= forecasts.size(); i++) {
            boolean marked = i < forecasts.size() && forecasts.get(i).getPredictedDemand() > limit;
            if (marked && runStart < 0) {
                runStart = i;
            } else if (!marked && runStart >= 0) {
                surges.add(toSurge(scope, forecasts.subList(runStart, i), baseline));
                runStart = -1;
            }
        }
        return surges;
    }

    public Severity severity(double peak, double baseline) {
        double ratio = peak / baseline;
        if (ratio > config.highBand()) {
            return Severity.HIGH;
        }
        if (ratio >= config.mediumBand()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private SurgePeriod toSurge(ScopeId scope, List<Forecast> run, double baseline) {
        double peak = run.stream().mapToDouble(Forecast::getPredictedDemand).max().orElse(0.0);
        Severity severity = severity(peak, baseline);
        return SurgePeriod.builder()
            .scope(scope)
            .startDate(run.get(0).getForecastDate())
            .endDate(run.get(run.size() - 1).getForecastDate())
            .dayCount(run.size())
            .peakValue(peak)
            .severity(severity)
            .recommendations(recommendations(run, severity))
            .build();
    }

    private List<String> recommendations(List<Forecast> run, Severity severity) {
        List<String> hints = new ArrayList<>();
        hints.add("Prepare for a " + run.size() + "-day surge starting " + run.get(0).getForecastDate());
        hints.add("Pre-stage additional materials");
        hints.add("Confirm equipment maintenance is complete");
        if (severity == Severity.HIGH) {
            hints.add("Consider overtime or temporary staff");
            hints.add("Defer non-critical maintenance during the peak");
            hints.add("Warn customers of potentially extended lead times");
        } else if (severity == Severity.MEDIUM) {
            hints.add("Optimise production schedules");
            hints.add("Monitor capacity closely");
        }
        return hints;
    }
}
