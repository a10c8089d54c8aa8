package com.dealplatform.negotiation.dto;

import com.dealplatform.common.agent.RecommendedAction;
import com.dealplatform.common.model.FailureReason;
import com.dealplatform.common.model.Negotiation;
import com.dealplatform.common.model.NegotiationDetails;
import com.dealplatform.common.model.NegotiationRound;
import com.dealplatform.common.model.NegotiationStatus;
import com.dealplatform.common.model.Offer;
import com.dealplatform.common.model.RoundDecision;
import com.dealplatform.negotiation.session.RoundOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a caller learns from one executed round.
 *
 * <p>{@code activeOffer} is {@code null} only once the negotiation has failed or the client
 * rejected every version; {@code shouldContinue} is {@code true} while further rounds are possible.
 */
public record RoundResult(
    @JsonProperty("negotiationId")        String            negotiationId,
    @JsonProperty("roundNumber")          int               roundNumber,
    @JsonProperty("maxRounds")            int               maxRounds,
    @JsonProperty("decision")             RoundDecision     decision,
    @JsonProperty("status")               NegotiationStatus status,
    @JsonProperty("failureReason")        FailureReason     failureReason,
    @JsonProperty("gap")                  double            gap,
    @JsonProperty("expectation")          Double            expectation,
    @JsonProperty("acceptanceLikelihood") double            acceptanceLikelihood,
    @JsonProperty("recommendedAction")    RecommendedAction recommendedAction,
    @JsonProperty("reasoning")            String            reasoning,
    @JsonProperty("activeOffer")          Offer             activeOffer,
    @JsonProperty("shouldContinue")       boolean           shouldContinue
) {

    public static RoundResult from(RoundOutcome outcome) {
        NegotiationDetails details = outcome.details();
        Negotiation negotiation = details.negotiation();
        NegotiationRound round = outcome.round();
        return new RoundResult(
            details.id(),
            round.roundNumber(),
            negotiation.maxRounds(),
            round.decision(),
            negotiation.status(),
            negotiation.failureReason(),
            round.gap(),
            outcome.assessment().expectation(),
            round.acceptanceLikelihood(),
            round.recommendedAction(),
            round.reasoning(),
            details.activeOffer().orElse(null),
            negotiation.status() == NegotiationStatus.IN_PROGRESS);
    }
}
