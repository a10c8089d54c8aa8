package com.dealplatform.negotiation.dto;

import com.dealplatform.common.model.CounterProposal;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/negotiations/{id}/rounds.
 */
public record ExecuteRoundRequest(
    @JsonProperty("feedback")        String          feedback,
    @JsonProperty("counterProposal") CounterProposal counterProposal
) {}
