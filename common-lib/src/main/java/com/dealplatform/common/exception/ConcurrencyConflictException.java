package com.dealplatform.common.exception;

import com.dealplatform.common.model.NegotiationStatus;

/**
 * A mutation was attempted on a negotiation (or offer) whose state no longer allows it,
 * most commonly a negotiation that is already terminal.
 */
public class ConcurrencyConflictException extends NegotiationException {

    public ConcurrencyConflictException(String negotiationId, NegotiationStatus status, String attempted) {
        super(ErrorCode.CONCURRENCY_CONFLICT,
              "Cannot " + attempted + " negotiation=" + negotiationId + " in status=" + status);
    }

    public ConcurrencyConflictException(String message) {
        super(ErrorCode.CONCURRENCY_CONFLICT, message);
    }
}
