package com.dealplatform.negotiation.controller;

import com.dealplatform.common.model.Negotiation;
import com.dealplatform.common.model.NegotiationDetails;
import com.dealplatform.common.model.NegotiationRound;
import com.dealplatform.negotiation.dto.ExecuteRoundRequest;
import com.dealplatform.negotiation.dto.InitiateNegotiationRequest;
import com.dealplatform.negotiation.dto.NegotiationAnalysis;
import com.dealplatform.negotiation.dto.RoundResult;
import com.dealplatform.negotiation.service.NegotiationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * REST surface of the negotiation engine. Delegates straight to the orchestrator; errors
 * are rendered by {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/negotiations")
public class NegotiationController {

    private static final Logger log = LoggerFactory.getLogger(NegotiationController.class);

    private final NegotiationOrchestrator orchestrator;

    public NegotiationController(NegotiationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public Mono<ResponseEntity<NegotiationDetails>> initiate(@RequestBody InitiateNegotiationRequest request) {
        log.info("Negotiation initiation requested. clientId={} tradeIn={} target={} marginTarget={}",
            request.clientId(), request.tradeInVehicleId(), request.targetVehicleId(), request.marginTarget());
        return orchestrator.initiate(request.clientId(), request.tradeInVehicleId(),
                                     request.targetVehicleId(), request.marginTarget())
            .map(details -> ResponseEntity.status(HttpStatus.CREATED).body(details));
    }

    @PostMapping("/{negotiationId}/rounds")
    public Mono<ResponseEntity<RoundResult>> executeRound(@PathVariable String negotiationId,
                                                          @RequestBody ExecuteRoundRequest request) {
        log.info("Round requested. negotiationId={} counterProposal={}",
            negotiationId, request.counterProposal() != null);
        return orchestrator.executeRound(negotiationId, request.feedback(), request.counterProposal())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{negotiationId}")
    public Mono<ResponseEntity<NegotiationDetails>> details(@PathVariable String negotiationId) {
        return orchestrator.getDetails(negotiationId).map(ResponseEntity::ok);
    }

    @GetMapping("/{negotiationId}/history")
    public Flux<NegotiationRound> history(@PathVariable String negotiationId) {
        return orchestrator.getHistory(negotiationId);
    }

    @GetMapping("/{negotiationId}/analysis")
    public Mono<ResponseEntity<NegotiationAnalysis>> analysis(@PathVariable String negotiationId) {
        return orchestrator.getAnalysis(negotiationId).map(ResponseEntity::ok);
    }

    @PostMapping("/{negotiationId}/abandon")
    public Mono<ResponseEntity<NegotiationDetails>> abandon(@PathVariable String negotiationId) {
        log.info("Abandon requested. negotiationId={}", negotiationId);
        return orchestrator.abandon(negotiationId).map(ResponseEntity::ok);
    }

    @PostMapping("/offers/{offerId}/accept")
    public Mono<ResponseEntity<NegotiationDetails>> acceptOffer(@PathVariable String offerId) {
        log.info("Offer acceptance requested. offerId={}", offerId);
        return orchestrator.acceptOffer(offerId).map(ResponseEntity::ok);
    }

    @PostMapping("/offers/{offerId}/reject")
    public Mono<ResponseEntity<NegotiationDetails>> rejectOffer(@PathVariable String offerId) {
        log.info("Offer rejection requested. offerId={}", offerId);
        return orchestrator.rejectOffer(offerId).map(ResponseEntity::ok);
    }

    @GetMapping("/client/{clientId}")
    public Flux<Negotiation> byClient(@PathVariable Long clientId) {
        return orchestrator.findByClient(clientId);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
