package com.demandengine.exception;

import lombok.Getter;

@Getter
public abstract class DemandEngineException extends RuntimeException {
    private final String errorCode;
    protected DemandEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected DemandEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
