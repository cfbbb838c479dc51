package com.demandengine.dto;

import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.ScopeId;
import com.demandengine.engine.model.SeasonalProfile;
import com.demandengine.engine.model.StaffingRecommendation;
import com.demandengine.engine.model.SurgePeriod;
import com.demandengine.engine.model.TrendDirection;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Output of one generation run for a scope: the persisted forecast series and
 * everything derived from it.
 */
@Value
@Builder
public class ForecastBundle {
    ScopeId scope;
    int horizonDays;
    String method;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    int historySize;
    double baseline;
    TrendDirection trend;
    boolean insufficientHistory;
    List<Forecast> forecasts;
    SeasonalProfile patterns;
    List<StaffingRecommendation> staffing;
    List<SurgePeriod> surges;
}
