package com.dealplatform.agents.context;

import com.dealplatform.common.model.ClientProfile;
import com.dealplatform.common.model.MarketSnapshot;
import com.dealplatform.common.model.Vehicle;

/**
 * Input of the trade-in evaluation role. {@code snapshot} is the market of the trade-in
 * vehicle's own segment, not the target's.
 */
public record TradeInContext(
    Vehicle        tradeInVehicle,
    MarketSnapshot snapshot,
    ClientProfile  client,
    int            referenceYear
) {}
