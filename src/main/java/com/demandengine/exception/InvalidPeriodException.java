package com.demandengine.exception;

import java.time.LocalDate;

public class InvalidPeriodException extends DemandEngineException {
    public InvalidPeriodException(LocalDate from, LocalDate to) {
        super("INVALID_PERIOD", "Period start " + from + " must be before or equal to period end " + to + ".");
    }
}
