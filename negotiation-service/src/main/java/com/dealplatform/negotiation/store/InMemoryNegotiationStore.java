package com.dealplatform.negotiation.store;

import com.dealplatform.common.exception.ConcurrencyConflictException;
import com.dealplatform.common.model.Negotiation;
import com.dealplatform.common.model.NegotiationDetails;
import com.dealplatform.common.model.Offer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Copy-on-write store: each save swaps in a new immutable aggregate, so readers never see
 * a round without its offer or the reverse.
 *
 * <p>A stored terminal aggregate is never replaced.
 */
@Repository
public class InMemoryNegotiationStore implements NegotiationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryNegotiationStore.class);

    private final ConcurrentHashMap<String, NegotiationDetails> negotiations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> offerOwners = new ConcurrentHashMap<>();

    @Override
    public Mono<NegotiationDetails> save(NegotiationDetails details) {
        return Mono.fromCallable(() -> {
            negotiations.compute(details.id(), (id, stored) -> {
                if (stored != null && stored.negotiation().isTerminal()) {
                    throw new ConcurrencyConflictException(id, stored.negotiation().status(), "overwrite");
                }
                return details;
            });
            for (Offer offer : details.offers()) {
                offerOwners.putIfAbsent(offer.id(), details.id());
            }
            log.debug("[NegotiationStore] saved negotiation={} status={} rounds={} offers={}",
                details.id(), details.negotiation().status(), details.rounds().size(), details.offers().size());
            return details;
        });
    }

    @Override
    public Mono<NegotiationDetails> findById(String negotiationId) {
        return Mono.justOrEmpty(negotiations.get(negotiationId));
    }

    @Override
    public Mono<String> findNegotiationIdByOfferId(String offerId) {
        return Mono.justOrEmpty(offerOwners.get(offerId));
    }

    @Override
    public Flux<Negotiation> findByClientId(Long clientId) {
        return Flux.fromIterable(negotiations.values())
            .map(NegotiationDetails::negotiation)
            .filter(n -> n.clientId().equals(clientId))
            .sort(Comparator.comparing(Negotiation::startedAt).reversed());
    }

    @Override
    public Flux<Negotiation> findActive() {
        return Flux.fromIterable(negotiations.values())
            .map(NegotiationDetails::negotiation)
            .filter(n -> !n.isTerminal());
    }
}
