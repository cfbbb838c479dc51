package com.demandengine.exception;

public class InvalidObservationException extends DemandEngineException {
    public InvalidObservationException(String message) {
        super("INVALID_OBSERVATION", message);
    }
}
