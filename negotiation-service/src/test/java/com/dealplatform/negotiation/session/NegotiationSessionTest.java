package com.dealplatform.negotiation.session;

import com.dealplatform.common.exception.ConcurrencyConflictException;
import com.dealplatform.common.model.CounterProposal;
import com.dealplatform.common.model.FailureReason;
import com.dealplatform.common.model.NegotiationDetails;
import com.dealplatform.common.model.NegotiationStatus;
import com.dealplatform.common.model.Offer;
import com.dealplatform.common.model.OfferStatus;
import com.dealplatform.common.model.RoundDecision;
import com.dealplatform.common.model.RoundStatus;
import com.dealplatform.negotiation.NegotiationFixtures;
import com.dealplatform.negotiation.config.NegotiationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.function.Supplier;

import static com.dealplatform.negotiation.NegotiationFixtures.NOW;
import static com.dealplatform.negotiation.NegotiationFixtures.hold;
import static com.dealplatform.negotiation.NegotiationFixtures.purchase;
import static com.dealplatform.negotiation.NegotiationFixtures.revise;
import static org.junit.jupiter.api.Assertions.*;

class NegotiationSessionTest {

    private static final int MAX_ROUNDS = 3;

    private NegotiationSession session;
    private Supplier<String> ids;
    private NegotiationDetails opened;

    @BeforeEach
    void setUp() {
        NegotiationPolicy policy = NegotiationFixtures.policy(MAX_ROUNDS);
        session = new NegotiationSession(policy, new PriceGapAcceptancePolicy(policy));
        ids = NegotiationFixtures.offerIds();
        opened = session.open(NegotiationFixtures.initiated("neg-1", MAX_ROUNDS),
            NegotiationFixtures.analysis(), NegotiationFixtures.snapshot(NegotiationFixtures.target()),
            NegotiationFixtures.noTradeIn(), NegotiationFixtures.structuring(), ids, NOW);
    }

    private RoundOutcome distantRound(NegotiationDetails details, double revisedPrice) {
        return session.applyRound(details, "Too expensive", CounterProposal.ofPrice(28_000),
            revise(purchase(revisedPrice), 0.4), ids, NOW);
    }

    @Test
    @DisplayName("opening places the best candidate as version 1 and keeps the rest as alternatives")
    void open() {
        assertEquals(NegotiationStatus.IN_PROGRESS, opened.negotiation().status());
        assertEquals(1, opened.offers().size());
        Offer first = opened.offers().get(0);
        assertEquals(1, first.version());
        assertEquals(OfferStatus.PROPOSED, first.status());
        assertEquals(32_000, first.effectivePrice());
        assertEquals(1, opened.negotiation().alternativeOffers().size());
        assertEquals(3, opened.negotiation().reasoningTrace().size());
        assertEquals(0, opened.negotiation().roundCount());
    }

    @Test
    @DisplayName("a negotiation cannot be opened twice")
    void openTwice() {
        assertThrows(ConcurrencyConflictException.class, () -> session.open(opened.negotiation(),
            NegotiationFixtures.analysis(), NegotiationFixtures.snapshot(NegotiationFixtures.target()),
            NegotiationFixtures.noTradeIn(), NegotiationFixtures.structuring(), ids, NOW));
    }

    @Nested
    @DisplayName("round decisions")
    class Rounds {

        @Test
        @DisplayName("a distant round with a revision continues and supersedes the offer")
        void continueWithRevision() {
            RoundOutcome outcome = distantRound(opened, 31_000);

            assertEquals(RoundDecision.CONTINUE, outcome.round().decision());
            assertEquals(RoundStatus.ONGOING, outcome.round().status());
            assertEquals(1, outcome.round().roundNumber());
            assertEquals(31_000, outcome.round().proposal().effectivePrice());

            NegotiationDetails details = outcome.details();
            assertEquals(NegotiationStatus.IN_PROGRESS, details.negotiation().status());
            assertEquals(OfferStatus.SUPERSEDED, details.offers().get(0).status());
            assertEquals(2, details.activeOffer().orElseThrow().version());
            assertEquals(outcome.round().offerId(), details.activeOffer().orElseThrow().id());
        }

        @Test
        @DisplayName("a round that holds its terms marks the offer as negotiating")
        void holdMarksNegotiating() {
            RoundOutcome outcome = session.applyRound(opened, "Let me think", null, hold(0.5), ids, NOW);

            assertEquals(RoundDecision.CONTINUE, outcome.round().decision());
            assertEquals(1, outcome.details().offers().size());
            assertEquals(OfferStatus.NEGOTIATING, outcome.details().activeOffer().orElseThrow().status());
        }

        @Test
        @DisplayName("a converged round waits for approval without revising the terms")
        void convergedRound() {
            RoundOutcome outcome = session.applyRound(opened, "Deal at 31500", CounterProposal.ofPrice(31_500),
                revise(purchase(31_500), 0.9), ids, NOW);

            assertEquals(RoundDecision.PENDING_APPROVAL, outcome.round().decision());
            assertEquals(RoundStatus.RESOLVED, outcome.round().status());
            assertEquals(NegotiationStatus.PENDING_APPROVAL, outcome.details().negotiation().status());
            assertEquals(1, outcome.details().offers().size());
            assertEquals(32_000, outcome.round().proposal().effectivePrice());
        }

        @Test
        @DisplayName("the penultimate round issues a final concession")
        void finalEffort() {
            NegotiationDetails afterFirst = distantRound(opened, 31_000).details();
            RoundOutcome second = distantRound(afterFirst, 30_000);

            assertEquals(RoundDecision.FINAL_EFFORT, second.round().decision());
            assertEquals(RoundStatus.ONGOING, second.round().status());
            assertTrue(second.round().proposal().finalConcession());
            assertTrue(second.details().activeOffer().orElseThrow().terms().finalConcession());
        }

        @Test
        @DisplayName("the last allowed round without convergence fails the negotiation")
        void roundLimit() {
            NegotiationDetails details = opened;
            for (int i = 0; i < MAX_ROUNDS; i++) {
                details = distantRound(details, 31_000 - i * 500).details();
            }

            assertEquals(NegotiationStatus.FAILED, details.negotiation().status());
            assertEquals(FailureReason.ROUND_LIMIT_EXHAUSTED, details.negotiation().failureReason());
            assertEquals(MAX_ROUNDS, details.negotiation().roundCount());
            assertEquals(MAX_ROUNDS, details.rounds().size());
            assertEquals(RoundDecision.ROUND_LIMIT_EXHAUSTED, details.rounds().get(MAX_ROUNDS - 1).decision());
            assertEquals(RoundStatus.RESOLVED, details.rounds().get(MAX_ROUNDS - 1).status());
            assertNotNull(details.negotiation().endedAt());
        }

        @Test
        @DisplayName("a failed negotiation accepts no further rounds")
        void terminalIsAbsorbing() {
            NegotiationDetails details = opened;
            for (int i = 0; i < MAX_ROUNDS; i++) {
                details = distantRound(details, 31_000).details();
            }
            NegotiationDetails failed = details;

            assertThrows(ConcurrencyConflictException.class, () -> distantRound(failed, 30_000));
            assertThrows(ConcurrencyConflictException.class,
                () -> session.accept(failed, failed.latestOffer().orElseThrow().id(), NOW));
            assertThrows(ConcurrencyConflictException.class, () -> session.abandon(failed, NOW));
        }

        @Test
        @DisplayName("round numbers are consecutive from 1")
        void consecutiveRoundNumbers() {
            NegotiationDetails details = distantRound(opened, 31_000).details();
            details = distantRound(details, 30_500).details();

            assertEquals(1, details.rounds().get(0).roundNumber());
            assertEquals(2, details.rounds().get(1).roundNumber());
            assertEquals(details.rounds().size(), details.negotiation().roundCount());
        }
    }

    @Nested
    @DisplayName("offer decisions")
    class Decisions {

        @Test
        @DisplayName("accepting the active offer concludes with its price and margin")
        void acceptConcludes() {
            NegotiationDetails pending = session.applyRound(opened, "Deal", null, hold(0.9), ids, NOW).details();
            String offerId = pending.activeOffer().orElseThrow().id();

            NegotiationDetails concluded = session.accept(pending, offerId, NOW);

            assertEquals(NegotiationStatus.CONCLUDED, concluded.negotiation().status());
            assertEquals(32_000, concluded.negotiation().finalPrice(), 1e-9);
            assertEquals(0.1875, concluded.negotiation().marginAchieved(), 1e-9);
            assertEquals(OfferStatus.ACCEPTED, concluded.findOffer(offerId).orElseThrow().status());
            assertNull(concluded.negotiation().failureReason());
        }

        @Test
        @DisplayName("a superseded version cannot be accepted")
        void acceptSuperseded() {
            NegotiationDetails details = distantRound(opened, 31_000).details();
            assertThrows(ConcurrencyConflictException.class, () -> session.accept(details, "offer-1", NOW));
        }

        @Test
        @DisplayName("rejecting while approval is pending re-opens the negotiation")
        void rejectReopens() {
            NegotiationDetails pending = session.applyRound(opened, "Deal", null, hold(0.9), ids, NOW).details();
            String offerId = pending.activeOffer().orElseThrow().id();

            NegotiationDetails reopened = session.reject(pending, offerId, NOW);

            assertEquals(NegotiationStatus.IN_PROGRESS, reopened.negotiation().status());
            assertTrue(reopened.activeOffer().isEmpty());
            assertEquals(offerId, session.standingOffer(reopened).id());
        }

        @Test
        @DisplayName("rejecting after the last allowed round fails with ROUND_LIMIT_EXHAUSTED")
        void rejectAtRoundLimit() {
            NegotiationDetails details = distantRound(opened, 31_000).details();
            details = distantRound(details, 30_500).details();
            NegotiationDetails pending = session.applyRound(details, "Deal", null, hold(0.9), ids, NOW).details();
            assertEquals(NegotiationStatus.PENDING_APPROVAL, pending.negotiation().status());
            assertEquals(MAX_ROUNDS, pending.negotiation().roundCount());
            String offerId = pending.activeOffer().orElseThrow().id();

            NegotiationDetails rejected = session.reject(pending, offerId, NOW);

            assertEquals(NegotiationStatus.FAILED, rejected.negotiation().status());
            assertEquals(FailureReason.ROUND_LIMIT_EXHAUSTED, rejected.negotiation().failureReason());
            assertNotNull(rejected.negotiation().endedAt());
            assertEquals(OfferStatus.REJECTED, rejected.findOffer(offerId).orElseThrow().status());
            assertThrows(ConcurrencyConflictException.class, () -> distantRound(rejected, 30_000));
        }

        @Test
        @DisplayName("a round after a rejection re-proposes the standing terms as a new version")
        void roundAfterReject() {
            String offerId = opened.activeOffer().orElseThrow().id();
            NegotiationDetails rejected = session.reject(opened, offerId, NOW);

            RoundOutcome outcome = session.applyRound(rejected, "Let me think", null, hold(0.5), ids, NOW);

            Offer active = outcome.details().activeOffer().orElseThrow();
            assertEquals(2, active.version());
            assertEquals(32_000, active.effectivePrice());
            assertEquals(OfferStatus.REJECTED, outcome.details().findOffer(offerId).orElseThrow().status());
        }

        @Test
        @DisplayName("abandoning fails the negotiation with reason ABANDONED")
        void abandon() {
            NegotiationDetails abandoned = session.abandon(opened, NOW);
            assertEquals(NegotiationStatus.FAILED, abandoned.negotiation().status());
            assertEquals(FailureReason.ABANDONED, abandoned.negotiation().failureReason());
        }
    }

    @Nested
    @DisplayName("session timeout")
    class Timeout {

        @Test
        @DisplayName("expiry is reached exactly at startedAt plus the timeout")
        void expiryBoundary() {
            assertFalse(session.isExpired(opened.negotiation(), NOW.plus(Duration.ofMinutes(30)).minusMillis(1)));
            assertTrue(session.isExpired(opened.negotiation(), NOW.plus(Duration.ofMinutes(30))));
        }

        @Test
        @DisplayName("expiring records TIMEOUT and ends the negotiation")
        void expire() {
            NegotiationDetails expired = session.expire(opened, NOW.plus(Duration.ofHours(1)));
            assertEquals(FailureReason.TIMEOUT, expired.negotiation().failureReason());
            assertFalse(session.isExpired(expired.negotiation(), NOW.plus(Duration.ofHours(2))));
        }
    }
}
