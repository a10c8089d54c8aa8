package com.dealplatform.common.model;

/**
 * Read-only client profile consumed by the agents.
 *
 * <p>{@code loyaltyScore} and {@code riskScore} are both in [0, 1]; loyalty drives the
 * trade-in bonus, risk drives how firmly the negotiation agent holds its price.
 */
public record ClientProfile(
    Long            id,
    String          firstName,
    String          lastName,
    double          budgetMin,
    double          budgetMax,
    FuelType        preferredFuel,
    Transmission    preferredTransmission,
    OfferPreference offerPreference,
    double          loyaltyScore,
    double          riskScore
) {

    public String fullName() {
        return firstName + " " + lastName;
    }

    /** An outlay is affordable when it does not exceed the upper budget bound. */
    public boolean canAfford(double outlay) {
        return outlay <= budgetMax;
    }

    public boolean budgetContains(double amount) {
        return amount >= budgetMin && amount <= budgetMax;
    }
}
