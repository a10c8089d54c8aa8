package com.dealplatform.negotiation.offer;

import com.dealplatform.common.exception.ConcurrencyConflictException;
import com.dealplatform.common.exception.NegotiationNotFoundException;
import com.dealplatform.common.model.Offer;
import com.dealplatform.common.model.OfferStatus;
import com.dealplatform.common.model.OfferTerms;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * The offer versions of one negotiation, oldest first.
 *
 * <p>Immutable: every operation returns a new book. At most one offer is active
 * ({@code PROPOSED} or {@code NEGOTIATING}) at any time; proposing a new version
 * supersedes the previous active one, it never edits its terms.
 */
public final class OfferBook {

    private final String negotiationId;
    private final List<Offer> offers;

    private OfferBook(String negotiationId, List<Offer> offers) {
        this.negotiationId = negotiationId;
        this.offers = List.copyOf(offers);
    }

    public static OfferBook empty(String negotiationId) {
        return new OfferBook(negotiationId, List.of());
    }

    public static OfferBook of(String negotiationId, List<Offer> offers) {
        long active = offers.stream().filter(Offer::isActive).count();
        if (active > 1) {
            throw new IllegalStateException("negotiation=" + negotiationId + " holds " + active + " active offers");
        }
        return new OfferBook(negotiationId, offers);
    }

    public List<Offer> offers() {
        return offers;
    }

    public Optional<Offer> active() {
        return offers.stream().filter(Offer::isActive).findFirst();
    }

    public Optional<Offer> find(String offerId) {
        return offers.stream().filter(o -> o.id().equals(offerId)).findFirst();
    }

    public int nextVersion() {
        return offers.size() + 1;
    }

    /** Appends a new {@code PROPOSED} version; the previous active offer becomes {@code SUPERSEDED}. */
    public OfferBook propose(OfferTerms terms, Supplier<String> idSupplier, Instant now) {
        List<Offer> next = new ArrayList<>(offers.size() + 1);
        for (Offer offer : offers) {
            next.add(offer.isActive() ? offer.withStatus(OfferStatus.SUPERSEDED) : offer);
        }
        next.add(new Offer(idSupplier.get(), negotiationId, nextVersion(), terms, OfferStatus.PROPOSED, now));
        return new OfferBook(negotiationId, next);
    }

    /** Marks the active offer as under discussion after a round held its terms. */
    public OfferBook markNegotiating() {
        return replaceWhere(Offer::isActive, OfferStatus.NEGOTIATING);
    }

    /** Only the active offer can be accepted. */
    public OfferBook accept(String offerId) {
        Offer offer = require(offerId);
        if (!offer.isActive()) {
            throw new ConcurrencyConflictException(
                "Offer " + offerId + " is " + offer.status() + "; only the active offer can be accepted");
        }
        return replaceWhere(o -> o.id().equals(offerId), OfferStatus.ACCEPTED);
    }

    /**
     * Rejects any offer that has not already been decided. Superseded versions may be
     * rejected too, which only records the client's verdict.
     */
    public OfferBook reject(String offerId) {
        Offer offer = require(offerId);
        if (offer.status() == OfferStatus.ACCEPTED || offer.status() == OfferStatus.REJECTED) {
            throw new ConcurrencyConflictException(
                "Offer " + offerId + " is already " + offer.status());
        }
        return replaceWhere(o -> o.id().equals(offerId), OfferStatus.REJECTED);
    }

    private Offer require(String offerId) {
        return find(offerId).orElseThrow(() -> new NegotiationNotFoundException("Offer", offerId));
    }

    private OfferBook replaceWhere(Predicate<Offer> match, OfferStatus status) {
        List<Offer> next = new ArrayList<>(offers.size());
        for (Offer offer : offers) {
            next.add(match.test(offer) ? offer.withStatus(status) : offer);
        }
        return new OfferBook(negotiationId, next);
    }
}
