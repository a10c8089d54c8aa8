package com.dealplatform.agents.support;

import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.exception.MalformedAgentOutputException;
import com.dealplatform.common.model.OfferTerms;
import com.dealplatform.common.model.OfferType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Wire shape of {@link OfferTerms} shared by the structuring and negotiation roles.
 */
public final class OfferTermsJson {

    public static final int MAX_DURATION_MONTHS = 84;

    private OfferTermsJson() {}

    public static ObjectNode write(ObjectMapper mapper, OfferTerms terms) {
        ObjectNode node = mapper.createObjectNode();
        node.put("offerType", terms.offerType().name());
        node.put("tradeInValue", terms.tradeInValue());
        if (terms.offerType().isMonthly()) {
            node.put("monthlyPayment", terms.monthlyPayment());
            node.put("durationMonths", terms.durationMonths());
        } else {
            node.put("purchasePrice", terms.purchasePrice());
        }
        node.put("effectivePrice", terms.effectivePrice());
        node.put("warrantyMonths", terms.warrantyMonths());
        node.put("maintenanceIncluded", terms.maintenanceIncluded());
        node.put("roadsideAssistance", terms.roadsideAssistance());
        node.put("insuranceIncluded", terms.insuranceIncluded());
        node.put("justification", terms.justification());
        node.put("confidence", terms.confidence());
        node.put("concession", terms.concession());
        return node;
    }

    /**
     * Reads and shape-checks one offer. Business constraints (margin, budget) are checked
     * by the calling agent, which knows the targets.
     */
    public static OfferTerms read(AgentRole role, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedAgentOutputException(role, "offer is not an object");
        }
        OfferType type = OutputSchema.requireEnum(role, node, "offerType", OfferType.class);
        double tradeInValue = OutputSchema.requireNonNegative(role, node, "tradeInValue");
        Double purchasePrice = null;
        Double monthlyPayment = null;
        Integer durationMonths = null;
        if (type.isMonthly()) {
            monthlyPayment = OutputSchema.requireNonNegative(role, node, "monthlyPayment");
            durationMonths = OutputSchema.requireInt(role, node, "durationMonths", 1, MAX_DURATION_MONTHS);
            if (monthlyPayment == 0) {
                throw new MalformedAgentOutputException(role, "monthlyPayment must be positive");
            }
        } else {
            purchasePrice = OutputSchema.requireNonNegative(role, node, "purchasePrice");
            if (purchasePrice == 0) {
                throw new MalformedAgentOutputException(role, "purchasePrice must be positive");
            }
        }
        return new OfferTerms(
            type,
            tradeInValue,
            purchasePrice,
            monthlyPayment,
            durationMonths,
            OutputSchema.requireInt(role, node, "warrantyMonths", 0, 120),
            OutputSchema.optionalFlag(node, "maintenanceIncluded"),
            OutputSchema.optionalFlag(node, "roadsideAssistance"),
            OutputSchema.optionalFlag(node, "insuranceIncluded"),
            OutputSchema.requireText(role, node, "justification"),
            OutputSchema.requireScore(role, node, "confidence"),
            OutputSchema.optionalFlag(node, "concession"),
            false);
    }
}
