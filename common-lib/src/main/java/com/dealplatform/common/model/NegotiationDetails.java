package com.dealplatform.common.model;

import java.util.List;
import java.util.Optional;

/**
 * A negotiation together with everything it owns: its offer versions (oldest first) and its
 * rounds (by round number). Stored and read as one value, so a reader always sees the
 * negotiation, its offers and its rounds from the same commit.
 */
public record NegotiationDetails(
    Negotiation            negotiation,
    List<Offer>            offers,
    List<NegotiationRound> rounds
) {

    public NegotiationDetails {
        offers = List.copyOf(offers);
        rounds = List.copyOf(rounds);
    }

    public String id() {
        return negotiation.id();
    }

    public Optional<Offer> activeOffer() {
        return offers.stream().filter(Offer::isActive).findFirst();
    }

    /** Most recent offer version regardless of status. */
    public Optional<Offer> latestOffer() {
        return offers.isEmpty() ? Optional.empty() : Optional.of(offers.get(offers.size() - 1));
    }

    public Optional<Offer> findOffer(String offerId) {
        return offers.stream().filter(o -> o.id().equals(offerId)).findFirst();
    }
}
