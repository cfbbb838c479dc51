package com.demandengine.exception;

/**
 * No observations at all for an operation that cannot degrade gracefully.
 */
public class NoDataException extends DemandEngineException {
    public NoDataException(String scopeKey) {
        super("NO_DATA", "No demand observations available for scope '" + scopeKey + "'.");
    }
}
