package com.dealplatform.common.exception;

import com.dealplatform.common.agent.AgentRole;

/**
 * Backend output failed the role's schema: missing field, out-of-range score or an offer
 * that violates its constraints without being flagged. Retryable like any backend failure.
 */
public class MalformedAgentOutputException extends ReasoningBackendException {

    public MalformedAgentOutputException(AgentRole role, String message) {
        super(role, BackendFailureKind.MALFORMED_OUTPUT, message);
    }
}
