package com.dealplatform.common.model;

public enum OfferType {
    PURCHASE,
    LEASE,
    SUBSCRIPTION;

    /** Lease and subscription offers are priced as a monthly payment over a duration. */
    public boolean isMonthly() {
        return this != PURCHASE;
    }
}
