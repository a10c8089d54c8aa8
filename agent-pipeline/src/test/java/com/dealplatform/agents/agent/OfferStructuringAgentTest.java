package com.dealplatform.agents.agent;

import com.dealplatform.agents.AgentFixtures;
import com.dealplatform.agents.context.OfferStructuringContext;
import com.dealplatform.agents.support.OfferTermsJson;
import com.dealplatform.common.agent.DemandLevel;
import com.dealplatform.common.agent.MarketAnalysis;
import com.dealplatform.common.agent.OfferStructuringResult;
import com.dealplatform.common.agent.PricingPosition;
import com.dealplatform.common.exception.MalformedAgentOutputException;
import com.dealplatform.common.model.ClientProfile;
import com.dealplatform.common.model.OfferTerms;
import com.dealplatform.common.model.OfferType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OfferStructuringAgentTest {

    private static final MarketAnalysis ANALYSIS = new MarketAnalysis(DemandLevel.MEDIUM,
        PricingPosition.AT_MARKET, List.of("42 listings"), "Anchor at list price", List.of());

    private final ObjectMapper mapper = new ObjectMapper();
    private final OfferStructuringAgent agent = new OfferStructuringAgent(mapper);

    private OfferStructuringContext context(ClientProfile client) {
        return new OfferStructuringContext(client, AgentFixtures.target(), ANALYSIS, 0.0, 0.15,
            List.of(OfferType.PURCHASE, OfferType.LEASE));
    }

    private ObjectNode output(OfferTerms... terms) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode offers = root.putArray("offers");
        for (OfferTerms t : terms) {
            offers.add(OfferTermsJson.write(mapper, t));
        }
        return root;
    }

    private static OfferTerms purchase(double price) {
        return OfferTerms.purchase(price, 0.0, 24, "Purchase at list", 0.8);
    }

    @Test
    @DisplayName("context exposes the margin floor derived from cost basis and target")
    void describe() {
        JsonNode described = agent.describe(context(AgentFixtures.client()));
        assertEquals(26_000 / 0.85, described.path("marginFloor").asDouble(), 1e-6);
        assertEquals(26_000, described.path("vehicle").path("costBasis").asDouble());
        assertEquals("PURCHASE", described.path("offerTypes").get(0).asText());
    }

    @Nested
    @DisplayName("accepted candidates")
    class Accepted {

        @Test
        @DisplayName("candidates meeting margin and budget are returned best first")
        void validCandidates() {
            OfferStructuringResult result = agent.parse(context(AgentFixtures.client()), output(
                purchase(32_000),
                OfferTerms.monthly(OfferType.LEASE, 888.89, 36, 0.0, "Lease", 0.7)));

            assertEquals(2, result.candidates().size());
            assertEquals(OfferType.PURCHASE, result.best().offerType());
            assertEquals(1, result.alternatives().size());
            assertFalse(result.constraintConflict());
        }

        @Test
        @DisplayName("below-target margin is allowed when flagged as a concession")
        void flaggedConcession() {
            OfferStructuringResult result = agent.parse(context(AgentFixtures.client()),
                output(purchase(29_000).asConcession()));
            assertTrue(result.best().concession());
        }

        @Test
        @DisplayName("over-budget candidate is allowed when the result declares a conflict")
        void declaredConflict() {
            ObjectNode node = output(purchase(30_600))
                .put("constraintConflict", true)
                .put("conflictReason", "Margin floor above budget");

            OfferStructuringResult result = agent.parse(context(AgentFixtures.client(15_000, 20_000)), node);

            assertTrue(result.constraintConflict());
            assertEquals("Margin floor above budget", result.conflictReason());
        }
    }

    @Nested
    @DisplayName("rejected output")
    class Rejected {

        @Test
        @DisplayName("margin below target without concession flag")
        void unflaggedMarginBreach() {
            assertThrows(MalformedAgentOutputException.class,
                () -> agent.parse(context(AgentFixtures.client()), output(purchase(29_000))));
        }

        @Test
        @DisplayName("over budget without a declared conflict")
        void undeclaredBudgetBreach() {
            assertThrows(MalformedAgentOutputException.class,
                () -> agent.parse(context(AgentFixtures.client()), output(purchase(41_000))));
        }

        @Test
        @DisplayName("conflict declared without a reason")
        void conflictWithoutReason() {
            ObjectNode node = output(purchase(30_600)).put("constraintConflict", true);
            assertThrows(MalformedAgentOutputException.class,
                () -> agent.parse(context(AgentFixtures.client(15_000, 20_000)), node));
        }

        @Test
        @DisplayName("offer type the client did not ask for")
        void disallowedType() {
            OfferTerms subscription = OfferTerms.monthly(OfferType.SUBSCRIPTION, 1_400, 24, 0.0, "Sub", 0.6);
            assertThrows(MalformedAgentOutputException.class,
                () -> agent.parse(context(AgentFixtures.client()), output(subscription)));
        }

        @Test
        @DisplayName("trade-in credit different from the evaluated value")
        void tradeInMismatch() {
            OfferTerms terms = OfferTerms.purchase(32_000, 5_000, 24, "Purchase", 0.8);
            assertThrows(MalformedAgentOutputException.class,
                () -> agent.parse(context(AgentFixtures.client()), output(terms)));
        }

        @Test
        @DisplayName("more than three candidates")
        void tooManyCandidates() {
            ObjectNode node = output(purchase(32_000), purchase(32_500), purchase(33_000), purchase(33_500));
            assertThrows(MalformedAgentOutputException.class,
                () -> agent.parse(context(AgentFixtures.client()), node));
        }

        @Test
        @DisplayName("no candidates at all")
        void noCandidates() {
            assertThrows(MalformedAgentOutputException.class,
                () -> agent.parse(context(AgentFixtures.client()), output()));
        }
    }
}
