package com.demandengine.exception;

import java.util.UUID;

public class ForecastNotFoundException extends DemandEngineException {
    public ForecastNotFoundException(UUID id) {
        super("FORECAST_NOT_FOUND", "Forecast with id '" + id + "' not found.");
    }
}
