package com.demandengine.engine.model;

/**
 * Width of the accepted band around the trailing mean, in standard deviations.
 */
public enum Sensitivity {
    LOW(3.0),
    MEDIUM(2.0),
    HIGH(1.5);

    private final double sigmas;

    Sensitivity(double sigmas) {
        this.sigmas = sigmas;
    }

    public double sigmas() {
        return sigmas;
    }
}
