package com.dealplatform.common.model;

public enum NegotiationStatus {
    INITIATED,
    IN_PROGRESS,
    PENDING_APPROVAL,
    CONCLUDED,
    FAILED;

    /** {@code CONCLUDED} and {@code FAILED} are absorbing. */
    public boolean isTerminal() {
        return this == CONCLUDED || this == FAILED;
    }
}
