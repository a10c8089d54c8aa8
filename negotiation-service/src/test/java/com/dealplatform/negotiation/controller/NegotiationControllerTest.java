package com.dealplatform.negotiation.controller;

import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.exception.AgentFailureException;
import com.dealplatform.common.exception.ConcurrencyConflictException;
import com.dealplatform.common.exception.NegotiationNotFoundException;
import com.dealplatform.common.exception.ValidationException;
import com.dealplatform.common.model.CounterProposal;
import com.dealplatform.common.model.NegotiationDetails;
import com.dealplatform.common.model.NegotiationStatus;
import com.dealplatform.negotiation.MutableClock;
import com.dealplatform.negotiation.NegotiationFixtures;
import com.dealplatform.negotiation.dto.ExecuteRoundRequest;
import com.dealplatform.negotiation.dto.InitiateNegotiationRequest;
import com.dealplatform.negotiation.service.NegotiationOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NegotiationControllerTest {

    private NegotiationOrchestrator orchestrator;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        orchestrator = mock(NegotiationOrchestrator.class);
        client = WebTestClient.bindToController(new NegotiationController(orchestrator))
            .controllerAdvice(new GlobalExceptionHandler(new MutableClock(NegotiationFixtures.NOW)))
            .build();
    }

    @Test
    @DisplayName("POST /negotiations answers 201 with the opened negotiation")
    void initiate() {
        NegotiationDetails details = new NegotiationDetails(
            NegotiationFixtures.initiated("neg-1", 5), List.of(), List.of());
        when(orchestrator.initiate(1L, null, 1L, null)).thenReturn(Mono.just(details));

        client.post().uri("/api/v1/negotiations")
            .bodyValue(new InitiateNegotiationRequest(1L, null, 1L, null))
            .exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.negotiation.id").isEqualTo("neg-1")
            .jsonPath("$.negotiation.status").isEqualTo(NegotiationStatus.INITIATED.name());
    }

    @Test
    @DisplayName("a validation failure is a 400 with its error code")
    void validationError() {
        when(orchestrator.initiate(any(), any(), any(), any()))
            .thenReturn(Mono.error(new ValidationException("Unknown client id=99")));

        client.post().uri("/api/v1/negotiations")
            .bodyValue(new InitiateNegotiationRequest(99L, null, null, null))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.code").isEqualTo("VALIDATION_ERROR")
            .jsonPath("$.message").isEqualTo("Unknown client id=99");
    }

    @Test
    @DisplayName("the round body is passed through with its counter-proposal")
    void roundPassesCounterProposal() {
        when(orchestrator.executeRound(anyString(), anyString(), any()))
            .thenReturn(Mono.error(new AgentFailureException(AgentRole.NEGOTIATION, 3, new IllegalStateException("down"))));

        client.post().uri("/api/v1/negotiations/neg-1/rounds")
            .bodyValue(new ExecuteRoundRequest("Could you do 29000?", CounterProposal.ofPrice(29_000)))
            .exchange()
            .expectStatus().isEqualTo(502)
            .expectBody()
            .jsonPath("$.code").isEqualTo("AGENT_FAILURE");

        verify(orchestrator).executeRound(eq("neg-1"), eq("Could you do 29000?"), eq(CounterProposal.ofPrice(29_000)));
    }

    @Test
    @DisplayName("an unknown negotiation is a 404")
    void notFound() {
        when(orchestrator.getDetails("missing"))
            .thenReturn(Mono.error(new NegotiationNotFoundException("Negotiation", "missing")));

        client.get().uri("/api/v1/negotiations/missing")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.code").isEqualTo("NOT_FOUND");
    }

    @Test
    @DisplayName("an operation on a terminal negotiation is a 409")
    void conflict() {
        when(orchestrator.acceptOffer("offer-1"))
            .thenReturn(Mono.error(new ConcurrencyConflictException("neg-1", NegotiationStatus.FAILED, "accept an offer in")));

        client.post().uri("/api/v1/negotiations/offers/offer-1/accept")
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.code").isEqualTo("CONCURRENCY_CONFLICT");
    }

    @Test
    @DisplayName("a round without a counter-proposal passes null")
    void roundWithoutCounterProposal() {
        when(orchestrator.executeRound(anyString(), anyString(), isNull()))
            .thenReturn(Mono.error(new ConcurrencyConflictException("neg-1", NegotiationStatus.CONCLUDED, "execute a round in")));

        client.post().uri("/api/v1/negotiations/neg-1/rounds")
            .bodyValue(new ExecuteRoundRequest("Hello", null))
            .exchange()
            .expectStatus().isEqualTo(409);
    }

    @Test
    @DisplayName("health answers OK")
    void health() {
        client.get().uri("/api/v1/negotiations/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
