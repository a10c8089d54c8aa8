package com.dealplatform.common.model;

import com.dealplatform.common.agent.MarketAnalysis;
import com.dealplatform.common.agent.TradeInEvaluation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate root of a negotiation session.
 *
 * <p>Immutable: every transition returns a new instance through one of the copy-factories
 * below, and {@code NegotiationSession} is the only caller allowed to choose which one.
 * Once {@link NegotiationStatus#isTerminal()} holds, no copy-factory is called again.
 *
 * <ul>
 *   <li>{@code roundCount}        : number of recorded rounds, never reset</li>
 *   <li>{@code reasoningTrace}    : accumulated agent reasoning, one entry per agent step</li>
 *   <li>{@code marketSnapshot}    : the snapshot the market analysis was computed from</li>
 *   <li>{@code alternativeOffers} : structuring candidates not placed in the offer book</li>
 *   <li>{@code finalPrice}, {@code marginAchieved}, {@code chosenOfferType}: set on conclusion</li>
 *   <li>{@code failureReason}     : set only when {@code status == FAILED}</li>
 * </ul>
 */
public record Negotiation(
    String            id,
    Long              clientId,
    Long              tradeInVehicleId,
    Long              targetVehicleId,
    NegotiationStatus status,
    int               roundCount,
    int               maxRounds,
    double            marginTarget,
    double            costBasis,
    List<String>      reasoningTrace,
    MarketAnalysis    marketAnalysis,
    MarketSnapshot    marketSnapshot,
    boolean           marketDataDegraded,
    TradeInEvaluation tradeInEvaluation,
    double            tradeInValue,
    List<OfferTerms>  alternativeOffers,
    Double            finalPrice,
    Double            marginAchieved,
    OfferType         chosenOfferType,
    FailureReason     failureReason,
    Instant           startedAt,
    Instant           endedAt,
    Instant           updatedAt
) {

    public Negotiation {
        reasoningTrace    = List.copyOf(reasoningTrace);
        alternativeOffers = List.copyOf(alternativeOffers);
    }

    public static Negotiation initiate(String id, Long clientId, Long tradeInVehicleId, Long targetVehicleId,
                                       int maxRounds, double marginTarget, double costBasis, Instant now) {
        return new Negotiation(id, clientId, tradeInVehicleId, targetVehicleId,
            NegotiationStatus.INITIATED, 0, maxRounds, marginTarget, costBasis,
            List.of(), null, null, false, null, 0.0, List.of(),
            null, null, null, null, now, null, now);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Opening transition: analysis results attached, status moves to {@code IN_PROGRESS}. */
    public Negotiation opened(MarketAnalysis analysis, MarketSnapshot snapshot, TradeInEvaluation tradeIn,
                              List<OfferTerms> alternatives, List<String> trace, Instant now) {
        return new Negotiation(id, clientId, tradeInVehicleId, targetVehicleId,
            NegotiationStatus.IN_PROGRESS, roundCount, maxRounds, marginTarget, costBasis,
            appended(trace), analysis, snapshot, snapshot.degraded(), tradeIn, tradeIn.finalValue(),
            alternatives, finalPrice, marginAchieved, chosenOfferType, failureReason, startedAt, endedAt, now);
    }

    /** Records one more round and moves to {@code nextStatus}. */
    public Negotiation roundRecorded(NegotiationStatus nextStatus, String traceEntry, Instant now) {
        return new Negotiation(id, clientId, tradeInVehicleId, targetVehicleId,
            nextStatus, roundCount + 1, maxRounds, marginTarget, costBasis,
            appended(List.of(traceEntry)), marketAnalysis, marketSnapshot, marketDataDegraded,
            tradeInEvaluation, tradeInValue, alternativeOffers, finalPrice, marginAchieved,
            chosenOfferType, failureReason, startedAt, nextStatus.isTerminal() ? now : endedAt, now);
    }

    public Negotiation withStatus(NegotiationStatus nextStatus, Instant now) {
        return new Negotiation(id, clientId, tradeInVehicleId, targetVehicleId,
            nextStatus, roundCount, maxRounds, marginTarget, costBasis,
            reasoningTrace, marketAnalysis, marketSnapshot, marketDataDegraded,
            tradeInEvaluation, tradeInValue, alternativeOffers, finalPrice, marginAchieved,
            chosenOfferType, failureReason, startedAt, endedAt, now);
    }

    public Negotiation concluded(double price, double margin, OfferType offerType, Instant now) {
        return new Negotiation(id, clientId, tradeInVehicleId, targetVehicleId,
            NegotiationStatus.CONCLUDED, roundCount, maxRounds, marginTarget, costBasis,
            reasoningTrace, marketAnalysis, marketSnapshot, marketDataDegraded,
            tradeInEvaluation, tradeInValue, alternativeOffers, price, margin,
            offerType, null, startedAt, now, now);
    }

    public Negotiation failed(FailureReason reason, Instant now) {
        return new Negotiation(id, clientId, tradeInVehicleId, targetVehicleId,
            NegotiationStatus.FAILED, roundCount, maxRounds, marginTarget, costBasis,
            reasoningTrace, marketAnalysis, marketSnapshot, marketDataDegraded,
            tradeInEvaluation, tradeInValue, alternativeOffers, finalPrice, marginAchieved,
            chosenOfferType, reason, startedAt, now, now);
    }

    private List<String> appended(List<String> entries) {
        List<String> trace = new ArrayList<>(reasoningTrace);
        trace.addAll(entries);
        return trace;
    }
}
