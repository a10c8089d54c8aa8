package com.dealplatform.agents.agent;

import com.dealplatform.agents.context.NegotiationContext;
import com.dealplatform.agents.support.ContextJson;
import com.dealplatform.agents.support.OfferTermsJson;
import com.dealplatform.agents.support.OutputSchema;
import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.agent.NegotiationAdvice;
import com.dealplatform.common.agent.RecommendedAction;
import com.dealplatform.common.exception.MalformedAgentOutputException;
import com.dealplatform.common.model.CounterProposal;
import com.dealplatform.common.model.NegotiationRound;
import com.dealplatform.common.model.OfferTerms;
import com.dealplatform.common.model.OfferType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Reads the client's feedback against the current offer and proposes how to answer it.
 */
@Component
public class NegotiationAgent implements ReasoningAgent<NegotiationContext, NegotiationAdvice> {

    static final double MARGIN_TOLERANCE   = 1e-6;
    static final double TRADE_IN_TOLERANCE = 0.01;

    private final ObjectMapper objectMapper;

    public NegotiationAgent(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public AgentRole role() { return AgentRole.NEGOTIATION; }

    @Override
    public JsonNode describe(NegotiationContext context) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("client", ContextJson.client(objectMapper, context.client()));
        root.set("currentOffer", OfferTermsJson.write(objectMapper, context.currentOffer()));
        root.put("feedback", context.feedback());

        CounterProposal counter = context.counterProposal();
        if (counter != null) {
            ObjectNode node = root.putObject("counterProposal");
            if (counter.price() != null)          node.put("price", counter.price());
            if (counter.monthlyPayment() != null) node.put("monthlyPayment", counter.monthlyPayment());
            if (counter.durationMonths() != null) node.put("durationMonths", counter.durationMonths());
            if (counter.offerType() != null)      node.put("offerType", counter.offerType().name());
            if (counter.note() != null)           node.put("note", counter.note());
            Double expected = counter.expectedPrice();
            if (expected != null)                 node.put("expectedPrice", expected);
        }

        ArrayNode history = root.putArray("history");
        for (NegotiationRound round : context.history()) {
            ObjectNode entry = history.addObject();
            entry.put("roundNumber",          round.roundNumber());
            entry.put("proposedPrice",        round.proposal().effectivePrice());
            entry.put("feedback",             round.feedback());
            entry.put("acceptanceLikelihood", round.acceptanceLikelihood());
            entry.put("decision",             round.decision().name());
        }

        root.put("roundNumber",  context.roundNumber());
        root.put("maxRounds",    context.maxRounds());
        root.put("finalEffort",  context.isFinalEffort());
        root.put("costBasis",    context.costBasis());
        root.put("marginTarget", context.marginTarget());
        ArrayNode types = root.putArray("offerTypes");
        context.offerTypes().forEach(t -> types.add(t.name()));
        return root;
    }

    @Override
    public NegotiationAdvice parse(NegotiationContext context, JsonNode output) {
        AgentRole role = role();
        double likelihood        = OutputSchema.requireScore(role, output, "acceptanceLikelihood");
        String reasoning         = OutputSchema.requireText(role, output, "reasoning");
        RecommendedAction action = OutputSchema.requireEnum(role, output, "recommendedAction", RecommendedAction.class);

        OfferTerms revised = null;
        JsonNode revisedNode = output.get("revisedOffer");
        if (revisedNode != null && !revisedNode.isNull()) {
            revised = OfferTermsJson.read(role, revisedNode);
            check(context, revised);
        }
        return new NegotiationAdvice(revised, likelihood, reasoning, action);
    }

    /** A revision keeps the credited trade-in and one of the allowed offer types. */
    private void check(NegotiationContext context, OfferTerms revised) {
        AgentRole role = role();
        OfferType type = revised.offerType();
        if (!context.offerTypes().contains(type)) {
            throw new MalformedAgentOutputException(role,
                "revised offer type " + type + " not allowed; expected one of " + context.offerTypes());
        }
        double credited = context.currentOffer().tradeInValue();
        if (Math.abs(revised.tradeInValue() - credited) > TRADE_IN_TOLERANCE) {
            throw new MalformedAgentOutputException(role, String.format(
                "revised offer credits tradeIn=%.2f, current offer credits %.2f",
                revised.tradeInValue(), credited));
        }
        double margin = revised.margin(context.costBasis());
        if (margin < context.marginTarget() - MARGIN_TOLERANCE && !revised.concession()) {
            throw new MalformedAgentOutputException(role, String.format(
                "revised offer margin=%.4f below target=%.4f and not flagged as concession",
                margin, context.marginTarget()));
        }
    }
}
