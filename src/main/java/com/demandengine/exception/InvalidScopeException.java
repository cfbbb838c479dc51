package com.demandengine.exception;

public class InvalidScopeException extends DemandEngineException {
    public InvalidScopeException(String message) {
        super("INVALID_SCOPE", message);
    }
}
