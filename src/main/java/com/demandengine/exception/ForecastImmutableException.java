package com.demandengine.exception;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Raised when a scored forecast would be regenerated or rescored.
 */
public class ForecastImmutableException extends DemandEngineException {
    public ForecastImmutableException(UUID id) {
        super("FORECAST_IMMUTABLE", "Forecast '" + id + "' has already been scored and cannot be changed.");
    }

    public ForecastImmutableException(String scopeKey, LocalDate forecastDate, int horizonDays) {
        super("FORECAST_IMMUTABLE", "Forecast for scope '" + scopeKey + "' on " + forecastDate
              + " (horizon " + horizonDays + ") has already been scored and cannot be regenerated.");
    }
}
