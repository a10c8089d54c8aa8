package com.dealplatform.agents.agent;

import com.dealplatform.agents.context.OfferStructuringContext;
import com.dealplatform.agents.support.ContextJson;
import com.dealplatform.agents.support.OfferTermsJson;
import com.dealplatform.agents.support.OutputSchema;
import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.agent.OfferStructuringResult;
import com.dealplatform.common.exception.MalformedAgentOutputException;
import com.dealplatform.common.model.OfferTerms;
import com.dealplatform.common.model.OfferType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the opening offer candidates, best first.
 *
 * <p>Each candidate must meet the margin target unless it is flagged as a concession, and
 * must fit the client's budget unless the result as a whole declares a constraint conflict.
 */
@Component
public class OfferStructuringAgent implements ReasoningAgent<OfferStructuringContext, OfferStructuringResult> {

    static final int    MAX_CANDIDATES    = 3;
    static final double MARGIN_TOLERANCE  = 1e-6;
    /** Monthly payments are rounded to cents, so the outlay may overshoot by a few units. */
    static final double BUDGET_TOLERANCE  = 1.0;
    static final double TRADE_IN_TOLERANCE = 0.01;

    private final ObjectMapper objectMapper;

    public OfferStructuringAgent(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentRole role() { return AgentRole.OFFER_STRUCTURING; }

    @Override
    public JsonNode describe(OfferStructuringContext context) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("client", ContextJson.client(objectMapper, context.client()));

        ObjectNode vehicle = ContextJson.vehicle(objectMapper, context.targetVehicle());
        vehicle.put("costBasis", context.targetVehicle().costBasis());
        root.set("vehicle", vehicle);

        ObjectNode analysis = root.putObject("marketAnalysis");
        analysis.put("demandLevel",         context.marketAnalysis().demandLevel().name());
        analysis.put("pricingPosition",     context.marketAnalysis().pricingPosition().name());
        analysis.put("recommendedStrategy", context.marketAnalysis().recommendedStrategy());

        root.put("tradeInValue", context.tradeInValue());
        root.put("marginTarget", context.marginTarget());
        root.put("marginFloor",  context.marginFloor());
        ArrayNode types = root.putArray("offerTypes");
        context.offerTypes().forEach(t -> types.add(t.name()));
        return root;
    }

    @Override
    public OfferStructuringResult parse(OfferStructuringContext context, JsonNode output) {
        AgentRole role = role();
        JsonNode offers = output.get("offers");
        if (offers == null || !offers.isArray() || offers.isEmpty() || offers.size() > MAX_CANDIDATES) {
            throw new MalformedAgentOutputException(role,
                "'offers' must be an array of 1 to " + MAX_CANDIDATES + " candidates");
        }

        boolean conflict = OutputSchema.optionalFlag(output, "constraintConflict");
        String conflictReason = conflict ? OutputSchema.requireText(role, output, "conflictReason") : null;

        List<OfferTerms> candidates = new ArrayList<>();
        for (JsonNode node : offers) {
            OfferTerms terms = OfferTermsJson.read(role, node);
            check(context, terms, conflict);
            candidates.add(terms);
        }
        return new OfferStructuringResult(candidates, conflict, conflictReason);
    }

    private void check(OfferStructuringContext context, OfferTerms terms, boolean conflict) {
        AgentRole role = role();
        OfferType type = terms.offerType();
        if (!context.offerTypes().contains(type)) {
            throw new MalformedAgentOutputException(role,
                "offer type " + type + " not allowed; expected one of " + context.offerTypes());
        }
        if (Math.abs(terms.tradeInValue() - context.tradeInValue()) > TRADE_IN_TOLERANCE) {
            throw new MalformedAgentOutputException(role, String.format(
                "%s offer credits tradeIn=%.2f, evaluated value is %.2f",
                type, terms.tradeInValue(), context.tradeInValue()));
        }
        double margin = terms.margin(context.targetVehicle().costBasis());
        if (margin < context.marginTarget() - MARGIN_TOLERANCE && !terms.concession()) {
            throw new MalformedAgentOutputException(role, String.format(
                "%s offer margin=%.4f below target=%.4f and not flagged as concession",
                type, margin, context.marginTarget()));
        }
        if (terms.clientOutlay() > context.client().budgetMax() + BUDGET_TOLERANCE && !conflict) {
            throw new MalformedAgentOutputException(role, String.format(
                "%s offer outlay=%.2f exceeds budgetMax=%.2f without a declared constraint conflict",
                type, terms.clientOutlay(), context.client().budgetMax()));
        }
    }
}
