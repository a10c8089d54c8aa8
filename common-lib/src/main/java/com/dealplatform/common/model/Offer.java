package com.dealplatform.common.model;

import java.time.Instant;

/**
 * One immutable version of an offer inside a negotiation. Revisions produce a new
 * {@code Offer} with the next {@code version}; only {@code status} ever changes, and it
 * changes by replacement through {@link #withStatus(OfferStatus)}.
 */
public record Offer(
    String      id,
    String      negotiationId,
    int         version,
    OfferTerms  terms,
    OfferStatus status,
    Instant     createdAt
) {

    public Offer withStatus(OfferStatus newStatus) {
        return new Offer(id, negotiationId, version, terms, newStatus, createdAt);
    }

    public boolean isActive() {
        return status.isActive();
    }

    public OfferType offerType() {
        return terms.offerType();
    }

    public double effectivePrice() {
        return terms.effectivePrice();
    }
}
