package com.demandengine.dto;

import com.demandengine.engine.model.Forecast;
import com.demandengine.engine.model.ScopeId;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class ScoringSummary {
    ScopeId scope;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate upTo;
    int pending;
    int scored;
    int awaitingActual;
    List<Forecast> scoredForecasts;
}
