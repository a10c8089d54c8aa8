package com.dealplatform.common.model;

import java.util.List;

/**
 * Client's stated preference for how the target vehicle is financed.
 */
public enum OfferPreference {
    PURCHASE(List.of(OfferType.PURCHASE)),
    LEASE(List.of(OfferType.LEASE)),
    SUBSCRIPTION(List.of(OfferType.SUBSCRIPTION)),
    FLEXIBLE(List.of(OfferType.PURCHASE, OfferType.LEASE, OfferType.SUBSCRIPTION));

    private final List<OfferType> offerTypes;

    OfferPreference(List<OfferType> offerTypes) {
        this.offerTypes = offerTypes;
    }

    /** Offer types the structuring agent is asked to produce for this preference. */
    public List<OfferType> offerTypes() {
        return offerTypes;
    }
}
