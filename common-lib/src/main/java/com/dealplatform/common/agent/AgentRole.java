package com.dealplatform.common.agent;

/**
 * The four reasoning roles of the negotiation pipeline, in invocation order.
 */
public enum AgentRole {
    MARKET_ANALYSIS("MarketAnalysisAgent"),
    TRADE_IN_EVALUATION("TradeInEvaluationAgent"),
    OFFER_STRUCTURING("OfferStructuringAgent"),
    NEGOTIATION("NegotiationAgent");

    private final String agentName;

    AgentRole(String agentName) {
        this.agentName = agentName;
    }

    public String agentName() {
        return agentName;
    }
}
