package com.dealplatform.common.agent;

import java.util.List;

/**
 * Result of the market-analysis role for the target vehicle.
 */
public record MarketAnalysis(
    DemandLevel     demandLevel,
    PricingPosition pricingPosition,
    List<String>    competitiveFactors,
    String          recommendedStrategy,
    List<String>    riskFactors
) {

    public MarketAnalysis {
        competitiveFactors = List.copyOf(competitiveFactors);
        riskFactors        = List.copyOf(riskFactors);
    }
}
