package com.dealplatform.negotiation.store;

import com.dealplatform.common.model.Negotiation;
import com.dealplatform.common.model.NegotiationDetails;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence of whole negotiation aggregates. A save replaces the negotiation, its offers
 * and its rounds in one step; a read returns them as they were at a single save.
 */
public interface NegotiationStore {

    Mono<NegotiationDetails> save(NegotiationDetails details);

    Mono<NegotiationDetails> findById(String negotiationId);

    /** Id of the negotiation that owns the offer, empty if no negotiation does. */
    Mono<String> findNegotiationIdByOfferId(String offerId);

    Flux<Negotiation> findByClientId(Long clientId);

    /** Negotiations that are not yet concluded or failed. */
    Flux<Negotiation> findActive();
}
