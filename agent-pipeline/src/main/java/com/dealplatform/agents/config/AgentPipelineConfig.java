package com.dealplatform.agents.config;

import com.dealplatform.agents.backend.AnthropicReasoningBackend;
import com.dealplatform.agents.backend.RuleBasedReasoningBackend;
import com.dealplatform.agents.invoke.AgentInvocationPolicy;
import com.dealplatform.common.agent.ReasoningBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class AgentPipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentPipelineConfig.class);

    @Bean
    public AgentInvocationPolicy agentInvocationPolicy(
            @Value("${agents.timeout:PT20S}") Duration timeout,
            @Value("${agents.max-attempts:3}") int maxAttempts,
            @Value("${agents.backoff:PT0.2S}") Duration backoff) {
        log.info("[AgentPipelineConfig] timeout={} maxAttempts={} backoff={}", timeout, maxAttempts, backoff);
        return new AgentInvocationPolicy(timeout, maxAttempts, backoff);
    }

    /**
     * Anthropic when an API key is configured, otherwise the deterministic rule-based backend.
     */
    @Bean
    public ReasoningBackend reasoningBackend(
            WebClient.Builder builder,
            ObjectMapper objectMapper,
            @Value("${reasoning.anthropic.api-key:}") String apiKey,
            @Value("${reasoning.anthropic.base-url:https://api.anthropic.com}") String baseUrl,
            @Value("${reasoning.anthropic.model:claude-3-5-sonnet-20241022}") String model,
            @Value("${reasoning.anthropic.max-tokens:1024}") int maxTokens) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[AgentPipelineConfig] reasoning.anthropic.api-key not set; using rule-based backend");
            return new RuleBasedReasoningBackend(objectMapper);
        }
        WebClient client = builder
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        log.info("[AgentPipelineConfig] Anthropic backend model={}", model);
        return new AnthropicReasoningBackend(client, objectMapper, apiKey, model, maxTokens);
    }
}
