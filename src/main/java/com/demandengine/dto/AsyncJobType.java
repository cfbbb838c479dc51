package com.demandengine.dto;

public enum AsyncJobType {
    FORECAST_BATCH
}
