package com.demandengine.exception;

public class InvalidHorizonException extends DemandEngineException {
    public InvalidHorizonException(int horizonDays, int maxHorizon) {
        super("INVALID_HORIZON",
              "Horizon of " + horizonDays + " days is outside the accepted range 1.." + maxHorizon + ".");
    }
}
