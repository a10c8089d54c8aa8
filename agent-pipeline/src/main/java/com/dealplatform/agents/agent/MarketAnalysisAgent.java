package com.dealplatform.agents.agent;

import com.dealplatform.agents.context.MarketAnalysisContext;
import com.dealplatform.agents.support.ContextJson;
import com.dealplatform.agents.support.OutputSchema;
import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.agent.DemandLevel;
import com.dealplatform.common.agent.MarketAnalysis;
import com.dealplatform.common.agent.PricingPosition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

@Component
public class MarketAnalysisAgent implements ReasoningAgent<MarketAnalysisContext, MarketAnalysis> {

    private final ObjectMapper objectMapper;

    public MarketAnalysisAgent(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentRole role() { return AgentRole.MARKET_ANALYSIS; }

    @Override
    public JsonNode describe(MarketAnalysisContext context) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("vehicle", ContextJson.vehicle(objectMapper, context.targetVehicle()));
        root.set("market",  ContextJson.market(objectMapper, context.snapshot()));
        return root;
    }

    @Override
    public MarketAnalysis parse(MarketAnalysisContext context, JsonNode output) {
        AgentRole role = role();
        return new MarketAnalysis(
            OutputSchema.requireEnum(role, output, "demandLevel", DemandLevel.class),
            OutputSchema.requireEnum(role, output, "pricingPosition", PricingPosition.class),
            OutputSchema.requireTextList(role, output, "competitiveFactors"),
            OutputSchema.requireText(role, output, "recommendedStrategy"),
            OutputSchema.requireTextList(role, output, "riskFactors"));
    }
}
