package com.dealplatform.common.model;

import com.dealplatform.common.agent.RecommendedAction;

import java.time.Instant;

/**
 * Append-only record of one proposal/feedback exchange. Round numbers are 1-based and
 * gapless within a negotiation.
 *
 * <p>{@code proposal} is the offer terms standing at the end of the round: the revised
 * terms when the round proposed a new version, otherwise the terms that were held.
 */
public record NegotiationRound(
    String            negotiationId,
    int               roundNumber,
    OfferTerms        proposal,
    String            offerId,
    String            reasoning,
    String            feedback,
    CounterProposal   counterProposal,
    RecommendedAction recommendedAction,
    double            acceptanceLikelihood,
    double            gap,
    RoundDecision     decision,
    RoundStatus       status,
    Instant           createdAt
) {}
