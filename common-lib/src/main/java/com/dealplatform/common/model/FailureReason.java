package com.dealplatform.common.model;

/**
 * Reason code recorded when a negotiation ends in {@link NegotiationStatus#FAILED}.
 * None of these are errors: they are defined terminal outcomes.
 */
public enum FailureReason {
    ROUND_LIMIT_EXHAUSTED,
    TIMEOUT,
    ABANDONED
}
