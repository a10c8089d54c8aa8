package com.dealplatform.agents.context;

import com.dealplatform.common.agent.MarketAnalysis;
import com.dealplatform.common.model.ClientProfile;
import com.dealplatform.common.model.OfferType;
import com.dealplatform.common.model.Vehicle;

import java.util.List;

/**
 * Input of the offer-structuring role. {@code offerTypes} is ordered by client preference
 * and bounds which shapes the candidates may take.
 */
public record OfferStructuringContext(
    ClientProfile   client,
    Vehicle         targetVehicle,
    MarketAnalysis  marketAnalysis,
    double          tradeInValue,
    double          marginTarget,
    List<OfferType> offerTypes
) {

    public OfferStructuringContext {
        offerTypes = List.copyOf(offerTypes);
    }

    /** Lowest transaction value that still meets the margin target. */
    public double marginFloor() {
        return targetVehicle.costBasis() / (1.0 - marginTarget);
    }
}
