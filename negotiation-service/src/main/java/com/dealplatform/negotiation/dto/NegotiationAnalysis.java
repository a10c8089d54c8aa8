package com.dealplatform.negotiation.dto;

import com.dealplatform.common.agent.MarketAnalysis;
import com.dealplatform.common.model.FailureReason;
import com.dealplatform.common.model.Negotiation;
import com.dealplatform.common.model.NegotiationDetails;
import com.dealplatform.common.model.NegotiationStatus;
import com.dealplatform.common.model.OfferType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Summary view of a negotiation. {@code durationMinutes} stays {@code null} until the
 * negotiation ends; {@code latestGap} is {@code null} before the first round.
 */
public record NegotiationAnalysis(
    @JsonProperty("negotiationId")      String            negotiationId,
    @JsonProperty("status")             NegotiationStatus status,
    @JsonProperty("roundsExecuted")     int               roundsExecuted,
    @JsonProperty("maxRounds")          int               maxRounds,
    @JsonProperty("marginTarget")       double            marginTarget,
    @JsonProperty("tradeInValue")       double            tradeInValue,
    @JsonProperty("finalPrice")         Double            finalPrice,
    @JsonProperty("marginAchieved")     Double            marginAchieved,
    @JsonProperty("chosenOfferType")    OfferType         chosenOfferType,
    @JsonProperty("failureReason")      FailureReason     failureReason,
    @JsonProperty("marketAnalysis")     MarketAnalysis    marketAnalysis,
    @JsonProperty("marketDataDegraded") boolean           marketDataDegraded,
    @JsonProperty("latestGap")          Double            latestGap,
    @JsonProperty("offerVersions")      int               offerVersions,
    @JsonProperty("startedAt")          Instant           startedAt,
    @JsonProperty("durationMinutes")    Long              durationMinutes
) {

    public static NegotiationAnalysis of(NegotiationDetails details) {
        Negotiation n = details.negotiation();
        Double latestGap = details.rounds().isEmpty()
            ? null
            : details.rounds().get(details.rounds().size() - 1).gap();
        Long duration = n.endedAt() != null ? Duration.between(n.startedAt(), n.endedAt()).toMinutes() : null;
        return new NegotiationAnalysis(
            n.id(), n.status(), n.roundCount(), n.maxRounds(), n.marginTarget(), n.tradeInValue(),
            n.finalPrice(), n.marginAchieved(), n.chosenOfferType(), n.failureReason(),
            n.marketAnalysis(), n.marketDataDegraded(), latestGap, details.offers().size(),
            n.startedAt(), duration);
    }
}
