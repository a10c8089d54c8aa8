package com.dealplatform.common.agent;

public enum PricingPosition {
    ABOVE_MARKET,
    AT_MARKET,
    BELOW_MARKET
}
