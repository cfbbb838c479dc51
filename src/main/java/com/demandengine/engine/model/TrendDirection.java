package com.demandengine.engine.model;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
