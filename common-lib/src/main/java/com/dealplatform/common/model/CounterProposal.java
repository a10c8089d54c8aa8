package com.dealplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured counter-proposal a client may attach to round feedback. Either a target
 * {@code price} or a {@code monthlyPayment} over {@code durationMonths} may be given.
 */
public record CounterProposal(
    @JsonProperty("price")          Double    price,
    @JsonProperty("monthlyPayment") Double    monthlyPayment,
    @JsonProperty("durationMonths") Integer   durationMonths,
    @JsonProperty("offerType")      OfferType offerType,
    @JsonProperty("note")           String    note
) {

    public static CounterProposal ofPrice(double price) {
        return new CounterProposal(price, null, null, null, null);
    }

    /** Transaction value the client is asking for, or {@code null} if none can be derived. */
    @JsonIgnore
    public Double expectedPrice() {
        if (price != null) {
            return price;
        }
        if (monthlyPayment != null && durationMonths != null) {
            return monthlyPayment * durationMonths;
        }
        return null;
    }
}
