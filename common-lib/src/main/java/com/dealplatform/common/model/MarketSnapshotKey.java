package com.dealplatform.common.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Cache key for a market segment. Make and model are normalised (trimmed, lower-cased) so
 * that "Peugeot 3008" and " peugeot 3008" share one snapshot.
 */
public record MarketSnapshotKey(String make, String model, int year, FuelType fuel) {

    public MarketSnapshotKey {
        Objects.requireNonNull(make, "make");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(fuel, "fuel");
    }

    public static MarketSnapshotKey of(String make, String model, int year, FuelType fuel) {
        return new MarketSnapshotKey(normalise(make), normalise(model), year, fuel);
    }

    private static String normalise(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return make + "/" + model + "/" + year + "/" + fuel;
    }
}
