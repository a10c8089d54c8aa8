package com.dealplatform.agents.agent;

import com.dealplatform.agents.context.TradeInContext;
import com.dealplatform.agents.support.ContextJson;
import com.dealplatform.agents.support.OutputSchema;
import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.agent.TradeInEvaluation;
import com.dealplatform.common.exception.MalformedAgentOutputException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Values the client's trade-in vehicle.
 *
 * <p>The backend must return a {@code finalValue} that is the non-negative sum of its
 * components. A result that does not add up is rejected as malformed rather than corrected,
 * since the components are what the client is shown as the justification.
 */
@Component
public class TradeInEvaluationAgent implements ReasoningAgent<TradeInContext, TradeInEvaluation> {

    /** Rounding slack allowed between {@code finalValue} and the sum of its parts. */
    static final double SUM_TOLERANCE = 0.01;

    private final ObjectMapper objectMapper;

    public TradeInEvaluationAgent(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentRole role() { return AgentRole.TRADE_IN_EVALUATION; }

    @Override
    public JsonNode describe(TradeInContext context) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("vehicle", ContextJson.vehicle(objectMapper, context.tradeInVehicle()));
        root.set("market",  ContextJson.market(objectMapper, context.snapshot()));
        root.set("client",  ContextJson.client(objectMapper, context.client()));
        root.put("referenceYear", context.referenceYear());
        return root;
    }

    @Override
    public TradeInEvaluation parse(TradeInContext context, JsonNode output) {
        AgentRole role = role();
        double baseValue           = OutputSchema.requireNonNegative(role, output, "baseValue");
        double conditionAdjustment = OutputSchema.requireNumber(role, output, "conditionAdjustment");
        double loyaltyBonus        = OutputSchema.requireNonNegative(role, output, "loyaltyBonus");
        double finalValue          = OutputSchema.requireNonNegative(role, output, "finalValue");

        double expected = TradeInEvaluation.expectedFinalValue(baseValue, conditionAdjustment, loyaltyBonus);
        if (Math.abs(expected - finalValue) > SUM_TOLERANCE) {
            throw new MalformedAgentOutputException(role, String.format(
                "finalValue=%.2f does not match base=%.2f + condition=%.2f + loyalty=%.2f",
                finalValue, baseValue, conditionAdjustment, loyaltyBonus));
        }

        return new TradeInEvaluation(
            baseValue,
            conditionAdjustment,
            loyaltyBonus,
            expected,
            OutputSchema.requireScore(role, output, "confidence"),
            OutputSchema.requireText(role, output, "justification"));
    }
}
