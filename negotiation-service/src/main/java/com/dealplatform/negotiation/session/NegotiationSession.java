package com.dealplatform.negotiation.session;

import com.dealplatform.common.agent.MarketAnalysis;
import com.dealplatform.common.agent.NegotiationAdvice;
import com.dealplatform.common.agent.OfferStructuringResult;
import com.dealplatform.common.agent.TradeInEvaluation;
import com.dealplatform.common.exception.ConcurrencyConflictException;
import com.dealplatform.common.model.CounterProposal;
import com.dealplatform.common.model.FailureReason;
import com.dealplatform.common.model.MarketSnapshot;
import com.dealplatform.common.model.Negotiation;
import com.dealplatform.common.model.NegotiationDetails;
import com.dealplatform.common.model.NegotiationRound;
import com.dealplatform.common.model.NegotiationStatus;
import com.dealplatform.common.model.Offer;
import com.dealplatform.common.model.OfferTerms;
import com.dealplatform.common.model.RoundDecision;
import com.dealplatform.common.model.RoundStatus;
import com.dealplatform.negotiation.config.NegotiationPolicy;
import com.dealplatform.negotiation.offer.OfferBook;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * The negotiation state machine. Pure: every method maps an aggregate (plus agent output)
 * to the next aggregate and never touches storage, clocks or agents itself.
 *
 * <pre>
 *   INITIATED ──open──▶ IN_PROGRESS ◀──reject/round──▶ PENDING_APPROVAL
 *                           │                                │
 *                           ├── round limit / timeout / abandon ──▶ FAILED
 *                           └────────────── accept ─────────────▶ CONCLUDED
 * </pre>
 *
 * <p>Round decisions are evaluated in a fixed order: convergence first, then the final-effort
 * round ({@code maxRounds - 1}), then round-limit exhaustion ({@code maxRounds}), otherwise the
 * negotiation continues. Every decision appends exactly one round, so {@code roundCount}
 * always equals the number of recorded rounds.
 */
@Component
public class NegotiationSession {

    private final NegotiationPolicy policy;
    private final AcceptancePolicy acceptancePolicy;

    public NegotiationSession(NegotiationPolicy policy, AcceptancePolicy acceptancePolicy) {
        this.policy = policy;
        this.acceptancePolicy = acceptancePolicy;
    }

    // ── Opening ───────────────────────────────────────────────────────────────

    /**
     * Attaches the opening analysis and places the best structuring candidate in the offer
     * book as version 1. The other candidates stay on the negotiation as alternatives.
     */
    public NegotiationDetails open(Negotiation initiated, MarketAnalysis analysis, MarketSnapshot snapshot,
                                   TradeInEvaluation tradeIn, OfferStructuringResult structuring,
                                   Supplier<String> offerIds, Instant now) {
        if (initiated.status() != NegotiationStatus.INITIATED) {
            throw new ConcurrencyConflictException(initiated.id(), initiated.status(), "open");
        }
        List<String> trace = new ArrayList<>();
        trace.add("[MarketAnalysisAgent] demand=" + analysis.demandLevel()
            + " position=" + analysis.pricingPosition() + ": " + analysis.recommendedStrategy());
        trace.add(String.format("[TradeInEvaluationAgent] finalValue=%.2f: %s",
            tradeIn.finalValue(), tradeIn.justification()));
        OfferTerms best = structuring.best();
        trace.add(String.format("[OfferStructuringAgent] candidates=%d best=%s price=%.2f%s",
            structuring.candidates().size(), best.offerType(), best.effectivePrice(),
            structuring.constraintConflict() ? " conflict: " + structuring.conflictReason() : ""));

        OfferBook book = OfferBook.empty(initiated.id()).propose(best, offerIds, now);
        Negotiation opened = initiated.opened(analysis, snapshot, tradeIn, structuring.alternatives(), trace, now);
        return new NegotiationDetails(opened, book.offers(), List.of());
    }

    // ── Rounds ────────────────────────────────────────────────────────────────

    /** Offer the next round answers: the active one, or the latest version if it was rejected. */
    public Offer standingOffer(NegotiationDetails details) {
        return details.activeOffer()
            .or(details::latestOffer)
            .orElseThrow(() -> new ConcurrencyConflictException(
                "Negotiation " + details.id() + " has no offer to negotiate on"));
    }

    public RoundOutcome applyRound(NegotiationDetails details, String feedback, CounterProposal counterProposal,
                                   NegotiationAdvice advice, Supplier<String> offerIds, Instant now) {
        Negotiation negotiation = details.negotiation();
        requireRoundable(negotiation);

        OfferBook book = OfferBook.of(details.id(), details.offers());
        Offer standing = standingOffer(details);
        boolean hasActive = book.active().isPresent();
        GapAssessment assessment = acceptancePolicy.assess(standing.terms(), feedback, counterProposal, advice);
        int roundNumber = negotiation.roundCount() + 1;

        RoundDecision decision;
        NegotiationStatus nextStatus;
        if (assessment.converged()) {
            decision = RoundDecision.PENDING_APPROVAL;
            nextStatus = NegotiationStatus.PENDING_APPROVAL;
            // the client agreed to the standing terms; nothing is revised
            if (!hasActive) {
                book = book.propose(standing.terms(), offerIds, now);
            }
        } else if (roundNumber == negotiation.maxRounds() - 1) {
            decision = RoundDecision.FINAL_EFFORT;
            nextStatus = NegotiationStatus.IN_PROGRESS;
            if (advice.hasRevision()) {
                book = book.propose(advice.revisedOffer().asFinalConcession(), offerIds, now);
            } else {
                book = hasActive ? book.markNegotiating() : book.propose(standing.terms(), offerIds, now);
            }
        } else if (roundNumber >= negotiation.maxRounds()) {
            decision = RoundDecision.ROUND_LIMIT_EXHAUSTED;
            nextStatus = NegotiationStatus.FAILED;
        } else {
            decision = RoundDecision.CONTINUE;
            nextStatus = NegotiationStatus.IN_PROGRESS;
            if (advice.hasRevision()) {
                book = book.propose(advice.revisedOffer(), offerIds, now);
            } else {
                book = hasActive ? book.markNegotiating() : book.propose(standing.terms(), offerIds, now);
            }
        }

        Offer roundOffer = book.active().orElse(standing);
        RoundStatus roundStatus = decision == RoundDecision.CONTINUE || decision == RoundDecision.FINAL_EFFORT
            ? RoundStatus.ONGOING
            : RoundStatus.RESOLVED;

        NegotiationRound round = new NegotiationRound(
            details.id(),
            roundNumber,
            roundOffer.terms(),
            roundOffer.id(),
            advice.reasoning(),
            feedback,
            counterProposal,
            advice.recommendedAction(),
            advice.acceptanceLikelihood(),
            assessment.gap(),
            decision,
            roundStatus,
            now);

        String traceEntry = String.format("[Round %d] decision=%s gap=%.4f action=%s: %s",
            roundNumber, decision, assessment.gap(), advice.recommendedAction(), advice.reasoning());
        Negotiation next = negotiation.roundRecorded(nextStatus, traceEntry, now);
        if (decision == RoundDecision.ROUND_LIMIT_EXHAUSTED) {
            next = next.failed(FailureReason.ROUND_LIMIT_EXHAUSTED, now);
        }

        List<NegotiationRound> rounds = new ArrayList<>(details.rounds());
        rounds.add(round);
        return new RoundOutcome(new NegotiationDetails(next, book.offers(), rounds), round, assessment);
    }

    // ── Offer decisions ───────────────────────────────────────────────────────

    /** Accepting the active offer is the only way a negotiation concludes. */
    public NegotiationDetails accept(NegotiationDetails details, String offerId, Instant now) {
        Negotiation negotiation = details.negotiation();
        requireMutable(negotiation, "accept an offer in");

        OfferBook book = OfferBook.of(details.id(), details.offers()).accept(offerId);
        OfferTerms terms = book.find(offerId).orElseThrow().terms();
        double price = terms.effectivePrice();
        Negotiation concluded = negotiation.concluded(price, terms.margin(negotiation.costBasis()),
                                                      terms.offerType(), now);
        return new NegotiationDetails(concluded, book.offers(), details.rounds());
    }

    /**
     * Rejecting the active offer while approval is pending re-opens the negotiation so a further
     * round can revise the terms. When no round is left the negotiation fails with
     * {@link FailureReason#ROUND_LIMIT_EXHAUSTED} instead.
     */
    public NegotiationDetails reject(NegotiationDetails details, String offerId, Instant now) {
        Negotiation negotiation = details.negotiation();
        requireMutable(negotiation, "reject an offer in");

        OfferBook before = OfferBook.of(details.id(), details.offers());
        boolean wasActive = before.active().map(o -> o.id().equals(offerId)).orElse(false);
        OfferBook book = before.reject(offerId);

        Negotiation next;
        if (negotiation.status() == NegotiationStatus.PENDING_APPROVAL && wasActive) {
            next = negotiation.roundCount() >= negotiation.maxRounds()
                ? negotiation.failed(FailureReason.ROUND_LIMIT_EXHAUSTED, now)
                : negotiation.withStatus(NegotiationStatus.IN_PROGRESS, now);
        } else {
            next = negotiation.withStatus(negotiation.status(), now);
        }
        return new NegotiationDetails(next, book.offers(), details.rounds());
    }

    // ── Terminal transitions ──────────────────────────────────────────────────

    public NegotiationDetails abandon(NegotiationDetails details, Instant now) {
        requireMutable(details.negotiation(), "abandon");
        return withNegotiation(details, details.negotiation().failed(FailureReason.ABANDONED, now));
    }

    public NegotiationDetails expire(NegotiationDetails details, Instant now) {
        requireMutable(details.negotiation(), "time out");
        return withNegotiation(details, details.negotiation().failed(FailureReason.TIMEOUT, now));
    }

    /** Wall-clock limit reached; measured from {@code startedAt}, regardless of rounds. */
    public boolean isExpired(Negotiation negotiation, Instant now) {
        return !negotiation.isTerminal()
            && !now.isBefore(negotiation.startedAt().plus(policy.sessionTimeout()));
    }

    public void requireMutable(Negotiation negotiation, String operation) {
        if (negotiation.isTerminal()) {
            throw new ConcurrencyConflictException(negotiation.id(), negotiation.status(), operation);
        }
    }

    private void requireRoundable(Negotiation negotiation) {
        requireMutable(negotiation, "execute a round in");
        if (negotiation.status() == NegotiationStatus.INITIATED) {
            throw new ConcurrencyConflictException(negotiation.id(), negotiation.status(), "execute a round in");
        }
        if (negotiation.roundCount() >= negotiation.maxRounds()) {
            throw new ConcurrencyConflictException(
                "Negotiation " + negotiation.id() + " already used all " + negotiation.maxRounds() + " rounds");
        }
    }

    private static NegotiationDetails withNegotiation(NegotiationDetails details, Negotiation negotiation) {
        return new NegotiationDetails(negotiation, details.offers(), details.rounds());
    }

    public NegotiationPolicy policy() {
        return policy;
    }
}
