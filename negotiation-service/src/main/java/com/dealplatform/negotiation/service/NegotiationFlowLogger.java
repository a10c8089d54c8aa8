package com.dealplatform.negotiation.service;

import com.dealplatform.common.model.Negotiation;
import com.dealplatform.common.model.NegotiationRound;
import com.dealplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Lifecycle logging for negotiations. Pure side-effects; no method alters the pipeline.
 *
 * <p>Stages:
 * <ol>
 *   <li>{@link #INITIATED}                negotiation id assigned, participants resolved</li>
 *   <li>{@link #MARKET_SNAPSHOT_RESOLVED} target segment snapshot obtained (possibly degraded)</li>
 *   <li>{@link #AGENT_INVOKED}            one agent role returned a valid result</li>
 *   <li>{@link #ROUND_COMMITTED}          round and offer changes stored together</li>
 *   <li>{@link #OFFER_ACCEPTED} / {@link #OFFER_REJECTED}</li>
 *   <li>{@link #TERMINATED}               negotiation reached CONCLUDED or FAILED</li>
 * </ol>
 *
 * <p>With {@code doOnEach} the negotiation id is read from the Reactor Context:
 * <pre>
 *     .doOnEach(flowLogger.stage(NegotiationFlowLogger.AGENT_INVOKED))
 * </pre>
 */
@Component
public class NegotiationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(NegotiationFlowLogger.class);

    public static final String INITIATED                = "INITIATED";
    public static final String MARKET_SNAPSHOT_RESOLVED = "MARKET_SNAPSHOT_RESOLVED";
    public static final String AGENT_INVOKED            = "AGENT_INVOKED";
    public static final String ROUND_COMMITTED          = "ROUND_COMMITTED";
    public static final String OFFER_ACCEPTED           = "OFFER_ACCEPTED";
    public static final String OFFER_REJECTED           = "OFFER_REJECTED";
    public static final String TERMINATED               = "TERMINATED";

    /** Logs {@code stageName} on each {@code onNext}; errors and completion are ignored. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String negotiationId = TraceContextUtil.getNegotiationId(signal.getContextView());
            TraceContextUtil.withMdc(negotiationId, () ->
                log.info("[NegotiationFlow] stage={} negotiationId={} value={}",
                    stageName, negotiationId, signal.get() != null ? signal.get().getClass().getSimpleName() : "-"));
        };
    }

    public void log(String stageName, String negotiationId, String detail) {
        TraceContextUtil.withMdc(negotiationId, () ->
            log.info("[NegotiationFlow] stage={} negotiationId={} {}", stageName, negotiationId, detail));
    }

    public void roundCommitted(NegotiationRound round, Negotiation negotiation) {
        TraceContextUtil.withMdc(negotiation.id(), () ->
            log.info("[NegotiationFlow] stage={} negotiationId={} round={}/{} decision={} gap={} status={}",
                ROUND_COMMITTED, negotiation.id(), round.roundNumber(), negotiation.maxRounds(),
                round.decision(), String.format("%.4f", round.gap()), negotiation.status()));
        terminatedIfSo(negotiation);
    }

    public void terminatedIfSo(Negotiation negotiation) {
        if (!negotiation.isTerminal()) return;
        TraceContextUtil.withMdc(negotiation.id(), () ->
            log.info("[NegotiationFlow] stage={} negotiationId={} status={} reason={} finalPrice={} margin={}",
                TERMINATED, negotiation.id(), negotiation.status(), negotiation.failureReason(),
                negotiation.finalPrice(), negotiation.marginAchieved()));
    }
}
