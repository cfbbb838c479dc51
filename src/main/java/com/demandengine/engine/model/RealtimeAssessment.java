package com.demandengine.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of checking one current value against the trailing window.
 */
@Value
@Builder
public class RealtimeAssessment {
    boolean anomaly;
    Severity severity;
    double confidence;
    double expectedLow;
    double expectedHigh;
    double actualValue;
    String recommendation;
}
