package com.dealplatform.agents.context;

import com.dealplatform.common.model.MarketSnapshot;
import com.dealplatform.common.model.Vehicle;

public record MarketAnalysisContext(
    Vehicle        targetVehicle,
    MarketSnapshot snapshot
) {}
