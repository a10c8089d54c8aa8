package com.dealplatform.negotiation.dto;

import com.dealplatform.common.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ErrorResponse(
    @JsonProperty("code")      ErrorCode code,
    @JsonProperty("message")   String    message,
    @JsonProperty("timestamp") Instant   timestamp
) {}
