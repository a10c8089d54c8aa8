package com.dealplatform.negotiation.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodically fails negotiations that outlived the session timeout, so an idle negotiation
 * times out even when no further request touches it.
 *
 * <p>Each cycle is a fresh {@link Mono} scheduled after the previous one finishes; a failed
 * cycle is logged and the loop carries on.
 */
@Component
public class SessionTimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(SessionTimeoutSweeper.class);

    private final NegotiationOrchestrator orchestrator;
    private final Duration interval;
    private volatile Disposable nextCycle;
    private volatile boolean stopped;

    public SessionTimeoutSweeper(NegotiationOrchestrator orchestrator,
                                 @Value("${negotiation.timeout-sweep-interval:PT15S}") Duration interval) {
        this.orchestrator = orchestrator;
        this.interval = interval;
    }

    @PostConstruct
    public void start() {
        log.info("[TimeoutSweeper] started intervalSeconds={}", interval.toSeconds());
        scheduleNextCycle();
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable cycle = nextCycle;
        if (cycle != null) {
            cycle.dispose();
        }
    }

    /** Runs one sweep now; returns the number of negotiations it timed out. */
    public Mono<Long> sweep() {
        return orchestrator.expireOverdue()
            .doOnNext(n -> log.info("[TimeoutSweeper] TIMED_OUT negotiationId={} rounds={}", n.id(), n.roundCount()))
            .count();
    }

    private void scheduleNextCycle() {
        if (stopped) return;
        nextCycle = Mono.delay(interval)
            .then(sweep())
            .subscribe(
                count -> {
                    if (count > 0) {
                        log.info("[TimeoutSweeper] cycle done expired={}", count);
                    }
                    scheduleNextCycle();
                },
                err -> {
                    log.error("[TimeoutSweeper] cycle failed; rescheduling", err);
                    scheduleNextCycle();
                });
    }
}
