package com.dealplatform.agents.agent;

import com.dealplatform.agents.AgentFixtures;
import com.dealplatform.agents.context.TradeInContext;
import com.dealplatform.common.agent.TradeInEvaluation;
import com.dealplatform.common.exception.MalformedAgentOutputException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TradeInEvaluationAgentTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TradeInEvaluationAgent agent = new TradeInEvaluationAgent(mapper);
    private final TradeInContext context = new TradeInContext(
        AgentFixtures.tradeIn(),
        AgentFixtures.snapshot(AgentFixtures.tradeIn(), 11_500, 30),
        AgentFixtures.client(),
        2024);

    private ObjectNode output(double base, double condition, double loyalty, double finalValue) {
        return mapper.createObjectNode()
            .put("baseValue", base)
            .put("conditionAdjustment", condition)
            .put("loyaltyBonus", loyalty)
            .put("finalValue", finalValue)
            .put("confidence", 0.75)
            .put("justification", "Clio with average mileage for its age");
    }

    @Test
    @DisplayName("context carries vehicle, segment market and reference year")
    void describe() {
        JsonNode described = agent.describe(context);
        assertEquals("Clio", described.path("vehicle").path("model").asText());
        assertEquals(11_500, described.path("market").path("avgPrice").asDouble());
        assertEquals(2024, described.path("referenceYear").asInt());
        assertEquals(0.8, described.path("client").path("loyaltyScore").asDouble());
    }

    @Test
    @DisplayName("components that add up are accepted")
    void consistentSum() {
        TradeInEvaluation evaluation = agent.parse(context, output(9_500, 285, 152, 9_937));
        assertEquals(9_937, evaluation.finalValue(), 1e-9);
        assertEquals(0.75, evaluation.confidence());
    }

    @Test
    @DisplayName("final value that does not match its components is rejected")
    void inconsistentSum() {
        assertThrows(MalformedAgentOutputException.class,
            () -> agent.parse(context, output(9_500, 285, 152, 10_500)));
    }

    @Test
    @DisplayName("a negative sum is clamped to zero")
    void clampedToZero() {
        TradeInEvaluation evaluation = agent.parse(context, output(1_000, -2_500, 0, 0));
        assertEquals(0.0, evaluation.finalValue());
    }

    @Test
    @DisplayName("missing justification is malformed")
    void missingJustification() {
        ObjectNode node = output(9_500, 285, 152, 9_937);
        node.remove("justification");
        assertThrows(MalformedAgentOutputException.class, () -> agent.parse(context, node));
    }

    @Test
    @DisplayName("confidence outside [0, 1] is malformed")
    void confidenceOutOfRange() {
        ObjectNode node = output(9_500, 285, 152, 9_937).put("confidence", 1.4);
        assertThrows(MalformedAgentOutputException.class, () -> agent.parse(context, node));
    }
}
