package com.dealplatform.negotiation.controller;

import com.dealplatform.common.exception.ErrorCode;
import com.dealplatform.common.exception.NegotiationException;
import com.dealplatform.negotiation.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

/**
 * Maps the negotiation exception taxonomy onto HTTP statuses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(NegotiationException.class)
    public ResponseEntity<ErrorResponse> handle(NegotiationException e) {
        HttpStatus status = statusOf(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("[ErrorHandler] code={} message={}", e.getErrorCode(), e.getMessage());
        } else {
            log.warn("[ErrorHandler] code={} message={}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), clock.instant()));
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case VALIDATION_ERROR        -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND               -> HttpStatus.NOT_FOUND;
            case AGENT_FAILURE           -> HttpStatus.BAD_GATEWAY;
            case MARKET_DATA_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case CONCURRENCY_CONFLICT    -> HttpStatus.CONFLICT;
        };
    }
}
