package com.dealplatform.common.model;

/**
 * Assessed physical condition of a vehicle. {@link #valueFactor()} is the fraction of the
 * segment's market value the condition is worth relative to an average example.
 */
public enum VehicleCondition {
    EXCELLENT(0.08),
    GOOD(0.03),
    AVERAGE(0.0),
    ACCEPTABLE(-0.07);

    private final double valueFactor;

    VehicleCondition(double valueFactor) {
        this.valueFactor = valueFactor;
    }

    public double valueFactor() {
        return valueFactor;
    }
}
