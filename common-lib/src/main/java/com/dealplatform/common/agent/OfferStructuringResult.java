package com.dealplatform.common.agent;

import com.dealplatform.common.model.OfferTerms;

import java.util.List;

/**
 * Result of the offer-structuring role: 1–3 candidates, best first.
 *
 * <p>{@code constraintConflict} is raised when no candidate can honour both the margin
 * target and the client budget; {@code conflictReason} then says which one gave way.
 */
public record OfferStructuringResult(
    List<OfferTerms> candidates,
    boolean          constraintConflict,
    String           conflictReason
) {

    public OfferStructuringResult {
        candidates = List.copyOf(candidates);
    }

    public OfferTerms best() {
        return candidates.get(0);
    }

    public List<OfferTerms> alternatives() {
        return candidates.subList(1, candidates.size());
    }
}
