package com.demandengine.engine.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

@Value
@Builder
public class StaffingRecommendation {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;
    double predictedDemand;
    Map<String, Integer> requiredStaff;
    String reasoning;
}
