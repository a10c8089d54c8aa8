package com.dealplatform.common.model;

/**
 * Outcome of the round decision policy, in precedence order.
 */
public enum RoundDecision {
    /** Gap within threshold, awaiting an explicit accept or reject. */
    PENDING_APPROVAL,
    /** Penultimate round with a large gap: last concession issued. */
    FINAL_EFFORT,
    /** Last permitted round without convergence. */
    ROUND_LIMIT_EXHAUSTED,
    /** Regular round. Revised offer (if any) proposed, negotiation continues. */
    CONTINUE
}
