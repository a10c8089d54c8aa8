package com.dealplatform.agents.agent;

import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.exception.MalformedAgentOutputException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One reasoning role: how its input is presented to the backend and how the backend's raw
 * output is turned into a typed, validated result.
 *
 * <p>Implementations are stateless. {@link #parse} never returns a partially valid result;
 * anything outside the role's schema raises {@link MalformedAgentOutputException}, which the
 * invoker treats as a retryable attempt failure.
 *
 * @param <C> role input
 * @param <R> role result
 */
public interface ReasoningAgent<C, R> {

    AgentRole role();

    JsonNode describe(C context);

    R parse(C context, JsonNode output);

    default String agentName() {
        return role().agentName();
    }
}
