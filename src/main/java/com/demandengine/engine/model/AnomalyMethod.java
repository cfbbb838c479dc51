package com.demandengine.engine.model;

public enum AnomalyMethod {
    STATISTICAL,
    SEASONAL,
    TREND
}
