package com.demandengine.engine.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class AnomalyFinding {
    ScopeId scope;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    AnomalyMethod method;
    double observedValue;
    double expectedLow;
    double expectedHigh;
    Severity severity;
    String description;
}
