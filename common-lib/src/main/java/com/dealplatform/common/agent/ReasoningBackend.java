package com.dealplatform.common.agent;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Whatever actually does the reasoning for an agent role: an LLM call or a heuristic.
 *
 * <p>Implementations receive the role's structured context and return its raw structured
 * result. They signal failure with {@link com.dealplatform.common.exception.ReasoningBackendException}
 * and never validate the result themselves; schema checks belong to the agent that asked.
 */
public interface ReasoningBackend {

    Mono<JsonNode> invoke(AgentRole role, JsonNode context);

    /** Short label used in logs. */
    String name();
}
