package com.dealplatform.agents.backend;

import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.agent.ReasoningBackend;
import com.dealplatform.common.exception.BackendFailureKind;
import com.dealplatform.common.exception.ReasoningBackendException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reasoning backend on the Anthropic Messages API.
 *
 * <p>Each role gets a system prompt fixing its output schema; the context document is sent
 * as the user message. Timeouts and retries are applied by the caller, so this class only
 * classifies failures: transport and HTTP errors as {@code BACKEND_UNAVAILABLE}, and a reply
 * that holds no JSON object as {@code MALFORMED_OUTPUT}.
 */
public class AnthropicReasoningBackend implements ReasoningBackend {

    private static final Logger log = LoggerFactory.getLogger(AnthropicReasoningBackend.class);

    private static final String COMMON_RULES =
        "Respond with a single JSON object and nothing else. Use the exact field names given. "
        + "Scores and confidences are decimals between 0 and 1. Amounts are in the dealer's currency.";

    private static final Map<AgentRole, String> SYSTEM_PROMPTS = new EnumMap<>(AgentRole.class);

    static {
        SYSTEM_PROMPTS.put(AgentRole.MARKET_ANALYSIS,
            "You are a used-car market analyst. Given a target vehicle and statistics for its market segment, "
            + "assess demand and pricing position. Output fields: demandLevel (HIGH|MEDIUM|LOW), "
            + "pricingPosition (ABOVE_MARKET|AT_MARKET|BELOW_MARKET), competitiveFactors (array of strings), "
            + "recommendedStrategy (string), riskFactors (array of strings).");
        SYSTEM_PROMPTS.put(AgentRole.TRADE_IN_EVALUATION,
            "You are a trade-in appraiser. Given the client's vehicle, its segment statistics and the client's "
            + "loyalty, value the vehicle. Output fields: baseValue, conditionAdjustment (may be negative), "
            + "loyaltyBonus, finalValue, confidence, justification. finalValue MUST equal "
            + "max(0, baseValue + conditionAdjustment + loyaltyBonus).");
        SYSTEM_PROMPTS.put(AgentRole.OFFER_STRUCTURING,
            "You are a dealership offer designer. Build 1 to 3 offers, best first, using only the allowed "
            + "offerTypes. Output fields: offers (array), constraintConflict (boolean), conflictReason (string, "
            + "required when constraintConflict is true). Each offer has offerType (PURCHASE|LEASE|SUBSCRIPTION), "
            + "tradeInValue (exactly the given tradeInValue), purchasePrice for PURCHASE or monthlyPayment and "
            + "durationMonths for LEASE and SUBSCRIPTION, warrantyMonths, maintenanceIncluded, roadsideAssistance, "
            + "insuranceIncluded, justification, confidence, concession (boolean). The transaction value must be at "
            + "least marginFloor unless concession is true. The transaction value minus tradeInValue must not "
            + "exceed client.budgetMax unless constraintConflict is true.");
        SYSTEM_PROMPTS.put(AgentRole.NEGOTIATION,
            "You are an expert car-sale negotiator balancing client satisfaction with profitability. Analyse the "
            + "client's feedback against currentOffer and decide how to respond. Output fields: revisedOffer (an "
            + "offer object with the same fields as currentOffer, or null to hold the current terms), "
            + "acceptanceLikelihood, reasoning, recommendedAction (ACCEPT|ADJUST|HOLD_FIRM|CLOSE). A revised "
            + "transaction value below costBasis / (1 - marginTarget) requires concession true. When finalEffort "
            + "is true this is the last chance to close.");
    }

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public AnthropicReasoningBackend(WebClient anthropicClient, ObjectMapper objectMapper,
                                     String apiKey, String model, int maxTokens) {
        this.anthropicClient = anthropicClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override
    public String name() { return "anthropic:" + model; }

    @Override
    public Mono<JsonNode> invoke(AgentRole role, JsonNode context) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "system", SYSTEM_PROMPTS.get(role) + " " + COMMON_RULES,
            "messages", List.of(Map.of("role", "user", "content", context.toString()))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class))
            .onErrorMap(WebClientResponseException.class, e -> new ReasoningBackendException(
                role, BackendFailureKind.BACKEND_UNAVAILABLE, "HTTP " + e.getStatusCode().value(), e))
            .onErrorMap(WebClientRequestException.class, e -> new ReasoningBackendException(
                role, BackendFailureKind.BACKEND_UNAVAILABLE, e.getMessage(), e))
            .map(response -> extractJson(role, response))
            .doOnNext(json -> log.debug("[AnthropicBackend] role={} replied fields={}", role, json.size()));
    }

    /** Pulls the first JSON object out of the reply text, tolerating code fences and prose. */
    JsonNode extractJson(AgentRole role, String response) {
        String text;
        try {
            JsonNode root = objectMapper.readTree(response);
            text = root.path("content").path(0).path("text").asText("");
        } catch (JsonProcessingException e) {
            throw new ReasoningBackendException(role, BackendFailureKind.MALFORMED_OUTPUT,
                "unreadable API envelope", e);
        }

        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ReasoningBackendException(role, BackendFailureKind.MALFORMED_OUTPUT,
                "reply holds no JSON object");
        }
        try {
            return objectMapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new ReasoningBackendException(role, BackendFailureKind.MALFORMED_OUTPUT,
                "reply JSON does not parse", e);
        }
    }
}
