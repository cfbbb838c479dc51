package com.demandengine.engine.model;

import com.demandengine.exception.InvalidObservationException;

import java.time.LocalDate;

/**
 * Observed demand on one day. {@code imputed} marks values filled in by the
 * caller for gaps; the engine never fabricates observations itself.
 */
public record Observation(LocalDate date, double demand, boolean imputed) {

    public Observation {
        if (date == null) {
            throw new InvalidObservationException("observation date is required");
        }
        if (!Double.isFinite(demand) || demand < 0) {
            throw new InvalidObservationException("observed demand must be a finite value >= 0 but was " + demand + " on " + date);
        }
    }

    public static Observation of(LocalDate date, double demand) {
        return new Observation(date, demand, false);
    }
}
