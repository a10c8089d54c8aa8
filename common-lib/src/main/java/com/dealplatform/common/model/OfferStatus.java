package com.dealplatform.common.model;

/**
 * Lifecycle of a single offer version.
 *
 * <p>{@code PROPOSED} and {@code NEGOTIATING} mark the active offer. At most one offer per
 * negotiation carries either status. {@code SUPERSEDED} is assigned to the previous active
 * offer when a round proposes a new version.
 */
public enum OfferStatus {
    PROPOSED,
    NEGOTIATING,
    ACCEPTED,
    REJECTED,
    SUPERSEDED;

    public boolean isActive() {
        return this == PROPOSED || this == NEGOTIATING;
    }
}
