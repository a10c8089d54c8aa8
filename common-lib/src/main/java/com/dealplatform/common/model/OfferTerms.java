package com.dealplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Commercial terms of one offer, as produced by the structuring or negotiation agent.
 *
 * <p>Purchase offers carry {@code purchasePrice}; lease and subscription offers carry
 * {@code monthlyPayment} and {@code durationMonths}. {@link #effectivePrice()} normalises
 * both shapes to a single transaction value.
 */
public record OfferTerms(
    OfferType offerType,
    double    tradeInValue,
    Double    purchasePrice,
    Double    monthlyPayment,
    Integer   durationMonths,
    int       warrantyMonths,
    boolean   maintenanceIncluded,
    boolean   roadsideAssistance,
    boolean   insuranceIncluded,
    String    justification,
    double    confidence,
    boolean   concession,
    boolean   finalConcession
) {

    public static OfferTerms purchase(double price, double tradeInValue, int warrantyMonths,
                                      String justification, double confidence) {
        return new OfferTerms(OfferType.PURCHASE, tradeInValue, price, null, null, warrantyMonths,
                              false, false, false, justification, confidence, false, false);
    }

    public static OfferTerms monthly(OfferType type, double monthlyPayment, int durationMonths,
                                     double tradeInValue, String justification, double confidence) {
        return new OfferTerms(type, tradeInValue, null, monthlyPayment, durationMonths, durationMonths,
                              type == OfferType.SUBSCRIPTION, type == OfferType.SUBSCRIPTION,
                              type == OfferType.SUBSCRIPTION, justification, confidence, false, false);
    }

    @JsonIgnore
    public double effectivePrice() {
        if (offerType.isMonthly()) {
            return monthlyPayment * durationMonths;
        }
        return purchasePrice;
    }

    /** What the client actually pays once the trade-in is credited. */
    @JsonIgnore
    public double clientOutlay() {
        return effectivePrice() - tradeInValue;
    }

    /** Fractional profit relative to the transaction value. */
    public double margin(double costBasis) {
        double price = effectivePrice();
        return price <= 0 ? Double.NEGATIVE_INFINITY : (price - costBasis) / price;
    }

    public OfferTerms asConcession() {
        return new OfferTerms(offerType, tradeInValue, purchasePrice, monthlyPayment, durationMonths,
                              warrantyMonths, maintenanceIncluded, roadsideAssistance, insuranceIncluded,
                              justification, confidence, true, finalConcession);
    }

    public OfferTerms asFinalConcession() {
        return new OfferTerms(offerType, tradeInValue, purchasePrice, monthlyPayment, durationMonths,
                              warrantyMonths, maintenanceIncluded, roadsideAssistance, insuranceIncluded,
                              justification, confidence, true, true);
    }
}
