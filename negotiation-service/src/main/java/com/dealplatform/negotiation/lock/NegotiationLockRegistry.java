package com.dealplatform.negotiation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Non-blocking, FIFO mutual exclusion keyed by negotiation id.
 *
 * <p>Each caller installs its own release signal as the tail for its key and subscribes to its
 * action only once the previous tail has completed. No thread waits: a queued caller is just a
 * subscription to its predecessor's signal. Different keys never contend.
 *
 * <p>A caller cancelled while still queued hands its slot on only after its predecessor
 * releases, so a successor can never overtake a holder that is still running.
 */
@Component
public class NegotiationLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(NegotiationLockRegistry.class);

    private final ConcurrentHashMap<String, Mono<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> withLock(String negotiationId, Supplier<Mono<T>> action) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> release = Sinks.empty();
            Mono<Void> mine = release.asMono();
            AtomicReference<Mono<Void>> predecessor = new AtomicReference<>(Mono.empty());
            tails.compute(negotiationId, (id, previous) -> {
                if (previous != null) {
                    predecessor.set(previous);
                }
                return mine;
            });

            AtomicBoolean acquired = new AtomicBoolean();
            return predecessor.get()
                .then(Mono.defer(() -> {
                    acquired.set(true);
                    log.debug("[NegotiationLock] acquired negotiation={}", negotiationId);
                    return action.get();
                }))
                .doFinally(signal -> {
                    if (acquired.get()) {
                        release(negotiationId, mine, release);
                    } else {
                        predecessor.get()
                            .doFinally(s -> release(negotiationId, mine, release))
                            .subscribe();
                    }
                });
        });
    }

    private void release(String negotiationId, Mono<Void> mine, Sinks.Empty<Void> release) {
        release.tryEmitEmpty();
        tails.remove(negotiationId, mine);
    }

    /** Number of keys with a holder or waiters. */
    public int activeKeys() {
        return tails.size();
    }
}
