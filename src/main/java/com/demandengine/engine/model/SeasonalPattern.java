package com.demandengine.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SeasonalPattern {
    ScopeId scope;
    PatternType patternType;
    int periodIndex;
    double demandMultiplier;
    double confidenceScore;
    int sampleSize;
    Instant computedAt;
}
