package com.demandengine.engine.model;

public enum ForecastStatus {
    PENDING,
    SCORED
}
