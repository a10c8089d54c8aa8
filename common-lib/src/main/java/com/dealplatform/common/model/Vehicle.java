package com.dealplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Read-only catalog vehicle, used both as trade-in and as negotiation target.
 *
 * <p>{@code marketValue} is the listed retail estimate; {@code costBasis} is the dealer's
 * acquisition cost, the cost side of every margin computation.
 */
public record Vehicle(
    Long             id,
    String           vin,
    String           make,
    String           model,
    int              year,
    String           version,
    FuelType         fuel,
    Transmission     transmission,
    int              mileage,
    int              powerHp,
    VehicleCondition condition,
    double           marketValue,
    double           costBasis,
    boolean          inStock
) {

    /** Market segment this vehicle's snapshot is keyed by. */
    @JsonIgnore
    public MarketSnapshotKey segment() {
        return MarketSnapshotKey.of(make, model, year, fuel);
    }

    public String label() {
        return year + " " + make + " " + model + " (" + vin + ")";
    }
}
