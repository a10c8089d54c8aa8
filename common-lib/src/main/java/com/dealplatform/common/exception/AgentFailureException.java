package com.dealplatform.common.exception;

import com.dealplatform.common.agent.AgentRole;

/**
 * An agent role could not produce a valid result within its retry budget. Recoverable:
 * nothing was persisted, so the caller may simply retry the operation.
 */
public class AgentFailureException extends NegotiationException {

    private final AgentRole role;
    private final int attempts;

    public AgentFailureException(AgentRole role, int attempts, Throwable cause) {
        super(ErrorCode.AGENT_FAILURE,
              "[" + role.agentName() + "] failed after " + attempts + " attempt(s): "
                  + (cause != null ? cause.getMessage() : "unknown"),
              cause);
        this.role = role;
        this.attempts = attempts;
    }

    public AgentRole getRole() {
        return role;
    }

    public int getAttempts() {
        return attempts;
    }
}
