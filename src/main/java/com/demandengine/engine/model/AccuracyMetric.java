package com.demandengine.engine.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Aggregate accuracy over the scored forecasts of a period. All measures are
 * null when nothing was scored; {@code mape} is null when no actual was positive.
 */
@Value
@Builder
public class AccuracyMetric {
    ScopeId scope;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate periodStart;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate periodEnd;
    long sampleSize;
    Double mae;
    Double mape;
    Double rmse;
    Double accuracyRateWithinTolerance;
}
