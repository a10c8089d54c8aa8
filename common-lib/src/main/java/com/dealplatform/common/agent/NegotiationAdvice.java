package com.dealplatform.common.agent;

import com.dealplatform.common.model.OfferTerms;

/**
 * Result of the negotiation role for one round. {@code revisedOffer} is {@code null} when
 * the agent holds its current terms.
 */
public record NegotiationAdvice(
    OfferTerms        revisedOffer,
    double            acceptanceLikelihood,
    String            reasoning,
    RecommendedAction recommendedAction
) {

    public boolean hasRevision() {
        return revisedOffer != null;
    }
}
