package com.demandengine.engine.model;

import java.time.LocalDate;

public enum PatternType {
    WEEKLY(7),
    MONTHLY(12);

    private final int periods;

    PatternType(int periods) {
        this.periods = periods;
    }

    public int periods() {
        return periods;
    }

    /** Weekly: Monday=0 .. Sunday=6. Monthly: January=0 .. December=11. */
    public int periodIndex(LocalDate date) {
        return this == WEEKLY ? date.getDayOfWeek().getValue() - 1 : date.getMonthValue() - 1;
    }
}
