package com.dealplatform.common.exception;

import com.dealplatform.common.agent.AgentRole;

/**
 * A single attempt against the reasoning backend failed. Transient: the agent invoker
 * retries it until the attempt budget runs out.
 */
public class ReasoningBackendException extends RuntimeException {

    private final AgentRole role;
    private final BackendFailureKind kind;

    public ReasoningBackendException(AgentRole role, BackendFailureKind kind, String message) {
        super("[" + role.agentName() + "] " + kind + ": " + message);
        this.role = role;
        this.kind = kind;
    }

    public ReasoningBackendException(AgentRole role, BackendFailureKind kind, String message, Throwable cause) {
        super("[" + role.agentName() + "] " + kind + ": " + message, cause);
        this.role = role;
        this.kind = kind;
    }

    public AgentRole getRole() {
        return role;
    }

    public BackendFailureKind getKind() {
        return kind;
    }
}
