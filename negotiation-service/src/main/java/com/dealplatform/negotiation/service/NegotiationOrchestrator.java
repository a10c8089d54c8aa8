package com.dealplatform.negotiation.service;

import com.dealplatform.agents.AgentPipeline;
import com.dealplatform.agents.context.MarketAnalysisContext;
import com.dealplatform.agents.context.NegotiationContext;
import com.dealplatform.agents.context.OfferStructuringContext;
import com.dealplatform.agents.context.TradeInContext;
import com.dealplatform.common.agent.MarketAnalysis;
import com.dealplatform.common.agent.TradeInEvaluation;
import com.dealplatform.common.exception.ConcurrencyConflictException;
import com.dealplatform.common.exception.NegotiationNotFoundException;
import com.dealplatform.common.exception.ValidationException;
import com.dealplatform.common.model.ClientProfile;
import com.dealplatform.common.model.CounterProposal;
import com.dealplatform.common.model.MarketSnapshot;
import com.dealplatform.common.model.Negotiation;
import com.dealplatform.common.model.NegotiationDetails;
import com.dealplatform.common.model.NegotiationRound;
import com.dealplatform.common.model.NegotiationStatus;
import com.dealplatform.common.model.Offer;
import com.dealplatform.common.model.Vehicle;
import com.dealplatform.common.trace.TraceContextUtil;
import com.dealplatform.marketdata.cache.MarketSnapshotCache;
import com.dealplatform.negotiation.catalog.Catalog;
import com.dealplatform.negotiation.config.NegotiationPolicy;
import com.dealplatform.negotiation.dto.NegotiationAnalysis;
import com.dealplatform.negotiation.dto.RoundResult;
import com.dealplatform.negotiation.lock.NegotiationLockRegistry;
import com.dealplatform.negotiation.session.NegotiationSession;
import com.dealplatform.negotiation.store.NegotiationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Facade over the negotiation engine.
 *
 * <p>Every mutation of an existing negotiation runs under its per-id lock, re-reads the
 * aggregate inside the lock, checks the wall-clock limit, and commits the result in a single
 * store write. Agent calls happen before that write, so an agent failure leaves nothing
 * half-applied and the same call can simply be retried. Queries read the latest committed
 * aggregate without locking.
 */
@Service
public class NegotiationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(NegotiationOrchestrator.class);

    private final Catalog                 catalog;
    private final MarketSnapshotCache     snapshotCache;
    private final AgentPipeline           agentPipeline;
    private final NegotiationSession      session;
    private final NegotiationStore        store;
    private final NegotiationLockRegistry locks;
    private final NegotiationFlowLogger   flowLogger;
    private final NegotiationPolicy       policy;
    private final Clock                   clock;

    public NegotiationOrchestrator(Catalog catalog,
                                   MarketSnapshotCache snapshotCache,
                                   AgentPipeline agentPipeline,
                                   NegotiationSession session,
                                   NegotiationStore store,
                                   NegotiationLockRegistry locks,
                                   NegotiationFlowLogger flowLogger,
                                   Clock clock) {
        this.catalog       = catalog;
        this.snapshotCache = snapshotCache;
        this.agentPipeline = agentPipeline;
        this.session       = session;
        this.store         = store;
        this.locks         = locks;
        this.flowLogger    = flowLogger;
        this.policy        = session.policy();
        this.clock         = clock;
    }

    // ── Initiation ────────────────────────────────────────────────────────────

    /**
     * Opens a negotiation: resolves the participants, runs market analysis, trade-in
     * evaluation and offer structuring, and stores the result with its first offer.
     * Nothing is stored when any step fails.
     *
     * @param tradeInVehicleId optional; no trade-in credit when {@code null}
     * @param targetVehicleId  optional; auto-selected from stock when {@code null}
     * @param marginTarget     optional; the configured default when {@code null}
     */
    public Mono<NegotiationDetails> initiate(Long clientId, Long tradeInVehicleId, Long targetVehicleId,
                                             Double marginTarget) {
        double margin = marginTarget != null ? marginTarget : policy.defaultMarginTarget();
        if (clientId == null) {
            return Mono.error(new ValidationException("clientId is required"));
        }
        if (Double.isNaN(margin) || margin < 0 || margin > NegotiationPolicy.MAX_MARGIN_TARGET) {
            return Mono.error(new ValidationException(
                "marginTarget must be in [0," + NegotiationPolicy.MAX_MARGIN_TARGET + "], got " + margin));
        }
        if (tradeInVehicleId != null && tradeInVehicleId.equals(targetVehicleId)) {
            return Mono.error(new ValidationException("trade-in and target vehicle must differ"));
        }

        String negotiationId = UUID.randomUUID().toString();

        Mono<NegotiationDetails> pipeline = catalog.findClient(clientId)
            .switchIfEmpty(Mono.error(() -> new ValidationException("Unknown client id=" + clientId)))
            .flatMap(client -> resolveTarget(client, targetVehicleId)
                .zipWith(resolveTradeIn(tradeInVehicleId))
                .flatMap(vehicles -> open(negotiationId, client, vehicles.getT1(), vehicles.getT2(), margin)))
            .flatMap(store::save)
            .doOnNext(details -> log.info("[Negotiation] opened negotiationId={} status={} activeOffer={} alternatives={}",
                details.id(), details.negotiation().status(),
                details.activeOffer().map(Offer::id).orElse("-"), details.negotiation().alternativeOffers().size()))
            .doOnError(e -> log.warn("[Negotiation] initiation failed negotiationId={} clientId={} reason={}",
                negotiationId, clientId, e.getMessage()));

        return TraceContextUtil.withNegotiationId(pipeline, negotiationId);
    }

    private Mono<NegotiationDetails> open(String negotiationId, ClientProfile client, Vehicle target,
                                          Optional<Vehicle> tradeInVehicle, double margin) {
        Negotiation initiated = Negotiation.initiate(negotiationId, client.id(),
            tradeInVehicle.map(Vehicle::id).orElse(null), target.id(),
            policy.maxRounds(), margin, target.costBasis(), clock.instant());
        flowLogger.log(NegotiationFlowLogger.INITIATED, negotiationId, String.format(
            "client=%d target=%s tradeIn=%s marginTarget=%.3f", client.id(), target.label(),
            tradeInVehicle.map(Vehicle::label).orElse("none"), margin));

        return snapshotCache.get(target)
            .doOnNext(snapshot -> flowLogger.log(NegotiationFlowLogger.MARKET_SNAPSHOT_RESOLVED, negotiationId,
                "segment=" + snapshot.key() + " degraded=" + snapshot.degraded()))
            .flatMap(snapshot -> agentPipeline.analyzeMarket(new MarketAnalysisContext(target, snapshot))
                .doOnEach(flowLogger.stage(NegotiationFlowLogger.AGENT_INVOKED))
                .flatMap(analysis -> evaluateTradeIn(client, tradeInVehicle)
                    .flatMap(tradeIn -> structure(initiated, client, target, snapshot, analysis, tradeIn))));
    }

    private Mono<TradeInEvaluation> evaluateTradeIn(ClientProfile client, Optional<Vehicle> tradeInVehicle) {
        if (tradeInVehicle.isEmpty()) {
            return Mono.just(TradeInEvaluation.none());
        }
        Vehicle vehicle = tradeInVehicle.get();
        int referenceYear = LocalDate.now(clock).getYear();
        return snapshotCache.get(vehicle)
            .flatMap(snapshot -> agentPipeline.evaluateTradeIn(new TradeInContext(vehicle, snapshot, client, referenceYear)))
            .doOnEach(flowLogger.stage(NegotiationFlowLogger.AGENT_INVOKED));
    }

    private Mono<NegotiationDetails> structure(Negotiation initiated, ClientProfile client, Vehicle target,
                                               MarketSnapshot snapshot, MarketAnalysis analysis,
                                               TradeInEvaluation tradeIn) {
        OfferStructuringContext context = new OfferStructuringContext(client, target, analysis,
            tradeIn.finalValue(), initiated.marginTarget(), client.offerPreference().offerTypes());
        return agentPipeline.structureOffers(context)
            .doOnEach(flowLogger.stage(NegotiationFlowLogger.AGENT_INVOKED))
            .map(result -> session.open(initiated, analysis, snapshot, tradeIn, result,
                                        NegotiationOrchestrator::newId, clock.instant()));
    }

    /** Explicit target, or the first in-stock vehicle matching the client's preferences and budget. */
    private Mono<Vehicle> resolveTarget(ClientProfile client, Long targetVehicleId) {
        if (targetVehicleId != null) {
            return catalog.findVehicle(targetVehicleId)
                .switchIfEmpty(Mono.error(() -> new ValidationException("Unknown target vehicle id=" + targetVehicleId)))
                .flatMap(v -> v.inStock()
                    ? Mono.just(v)
                    : Mono.error(new ValidationException("Target vehicle id=" + targetVehicleId + " is not in stock")));
        }
        return catalog.findInStockVehicles()
            .filter(v -> client.preferredFuel() == null || v.fuel() == client.preferredFuel())
            .filter(v -> client.preferredTransmission() == null || v.transmission() == client.preferredTransmission())
            .filter(v -> client.budgetContains(v.marketValue()))
            .next()
            .doOnNext(v -> log.info("[Negotiation] target auto-selected client={} vehicle={}", client.id(), v.label()))
            .switchIfEmpty(Mono.error(() -> new ValidationException(
                "No in-stock vehicle matches the preferences and budget of client id=" + client.id())));
    }

    private Mono<Optional<Vehicle>> resolveTradeIn(Long tradeInVehicleId) {
        if (tradeInVehicleId == null) {
            return Mono.just(Optional.empty());
        }
        return catalog.findVehicle(tradeInVehicleId)
            .map(Optional::of)
            .switchIfEmpty(Mono.error(() -> new ValidationException("Unknown trade-in vehicle id=" + tradeInVehicleId)));
    }

    // ── Rounds ────────────────────────────────────────────────────────────────

    /**
     * Runs one negotiation round against the standing offer. On agent failure the round is
     * not recorded and the negotiation is left exactly as it was.
     */
    public Mono<RoundResult> executeRound(String negotiationId, String feedback, CounterProposal counterProposal) {
        if (counterProposal != null && !isValid(counterProposal)) {
            return Mono.error(new ValidationException("counterProposal amounts must be positive"));
        }
        String text = feedback != null ? feedback : "";

        Mono<RoundResult> pipeline = mutate(negotiationId, "execute a round in", details -> {
            Negotiation negotiation = details.negotiation();
            Offer standing = session.standingOffer(details);
            return catalog.findClient(negotiation.clientId())
                .switchIfEmpty(Mono.error(() -> new NegotiationNotFoundException("Client", negotiation.clientId())))
                .flatMap(client -> agentPipeline.negotiate(new NegotiationContext(
                    client, standing.terms(), text, counterProposal, details.rounds(),
                    negotiation.roundCount() + 1, negotiation.maxRounds(),
                    negotiation.costBasis(), negotiation.marginTarget(),
                    client.offerPreference().offerTypes())))
                .doOnEach(flowLogger.stage(NegotiationFlowLogger.AGENT_INVOKED))
                .map(advice -> session.applyRound(details, text, counterProposal, advice,
                                                  NegotiationOrchestrator::newId, clock.instant()))
                .flatMap(outcome -> store.save(outcome.details())
                    .doOnNext(saved -> flowLogger.roundCommitted(outcome.round(), saved.negotiation()))
                    .thenReturn(RoundResult.from(outcome)));
        });
        return TraceContextUtil.withNegotiationId(pipeline, negotiationId);
    }

    private static boolean isValid(CounterProposal counter) {
        return (counter.price() == null || counter.price() > 0)
            && (counter.monthlyPayment() == null || counter.monthlyPayment() > 0)
            && (counter.durationMonths() == null || counter.durationMonths() > 0);
    }

    // ── Offer decisions and abandonment ───────────────────────────────────────

    public Mono<NegotiationDetails> acceptOffer(String offerId) {
        return ownerOf(offerId).flatMap(negotiationId -> TraceContextUtil.withNegotiationId(
            mutate(negotiationId, "accept an offer in", details ->
                store.save(session.accept(details, offerId, clock.instant()))
                    .doOnNext(saved -> {
                        flowLogger.log(NegotiationFlowLogger.OFFER_ACCEPTED, negotiationId, "offer=" + offerId);
                        flowLogger.terminatedIfSo(saved.negotiation());
                    })),
            negotiationId));
    }

    public Mono<NegotiationDetails> rejectOffer(String offerId) {
        return ownerOf(offerId).flatMap(negotiationId -> TraceContextUtil.withNegotiationId(
            mutate(negotiationId, "reject an offer in", details ->
                store.save(session.reject(details, offerId, clock.instant()))
                    .doOnNext(saved -> {
                        flowLogger.log(NegotiationFlowLogger.OFFER_REJECTED, negotiationId,
                            "offer=" + offerId + " status=" + saved.negotiation().status());
                        flowLogger.terminatedIfSo(saved.negotiation());
                    })),
            negotiationId));
    }

    public Mono<NegotiationDetails> abandon(String negotiationId) {
        return TraceContextUtil.withNegotiationId(
            mutate(negotiationId, "abandon", details ->
                store.save(session.abandon(details, clock.instant()))
                    .doOnNext(saved -> flowLogger.terminatedIfSo(saved.negotiation()))),
            negotiationId);
    }

    /**
     * Fails every running negotiation whose wall-clock limit has passed.
     *
     * @return the negotiations that were timed out by this call
     */
    public Flux<Negotiation> expireOverdue() {
        return store.findActive()
            .filter(n -> session.isExpired(n, clock.instant()))
            .flatMap(n -> locks.withLock(n.id(), () -> store.findById(n.id())
                .filter(details -> session.isExpired(details.negotiation(), clock.instant()))
                .flatMap(details -> store.save(session.expire(details, clock.instant())))
                .map(NegotiationDetails::negotiation)
                .doOnNext(flowLogger::terminatedIfSo)));
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public Mono<NegotiationDetails> getDetails(String negotiationId) {
        return load(negotiationId);
    }

    public Flux<NegotiationRound> getHistory(String negotiationId) {
        return load(negotiationId).flatMapIterable(NegotiationDetails::rounds);
    }

    public Mono<NegotiationAnalysis> getAnalysis(String negotiationId) {
        return load(negotiationId).map(NegotiationAnalysis::of);
    }

    public Flux<Negotiation> findByClient(Long clientId) {
        return store.findByClientId(clientId);
    }

    // ── Internals ─────────────────────────────────────────────────────────────

    /**
     * Serialises {@code action} with every other mutation of the same negotiation. The action
     * receives the aggregate as re-read under the lock. An overdue negotiation is timed out
     * and committed first, after which the requested operation is refused.
     */
    private <T> Mono<T> mutate(String negotiationId, String operation, Function<NegotiationDetails, Mono<T>> action) {
        return locks.withLock(negotiationId, () -> load(negotiationId)
            .flatMap(details -> {
                Negotiation negotiation = details.negotiation();
                session.requireMutable(negotiation, operation);
                if (session.isExpired(negotiation, clock.instant())) {
                    return store.save(session.expire(details, clock.instant()))
                        .doOnNext(saved -> flowLogger.terminatedIfSo(saved.negotiation()))
                        .then(Mono.<T>error(new ConcurrencyConflictException(
                            negotiationId, NegotiationStatus.FAILED, operation)));
                }
                return action.apply(details);
            }));
    }

    private Mono<NegotiationDetails> load(String negotiationId) {
        return store.findById(negotiationId)
            .switchIfEmpty(Mono.error(() -> new NegotiationNotFoundException("Negotiation", negotiationId)));
    }

    private Mono<String> ownerOf(String offerId) {
        return store.findNegotiationIdByOfferId(offerId)
            .switchIfEmpty(Mono.error(() -> new NegotiationNotFoundException("Offer", offerId)));
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
