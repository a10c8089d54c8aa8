package com.dealplatform.negotiation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/negotiations. Only {@code clientId} is required.
 */
public record InitiateNegotiationRequest(
    @JsonProperty("clientId")         Long   clientId,
    @JsonProperty("tradeInVehicleId") Long   tradeInVehicleId,
    @JsonProperty("targetVehicleId")  Long   targetVehicleId,
    @JsonProperty("marginTarget")     Double marginTarget
) {}
