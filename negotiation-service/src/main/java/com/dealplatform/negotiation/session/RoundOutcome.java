package com.dealplatform.negotiation.session;

import com.dealplatform.common.model.NegotiationDetails;
import com.dealplatform.common.model.NegotiationRound;

/**
 * Everything one round commits: the new aggregate and the round it appended.
 */
public record RoundOutcome(
    NegotiationDetails details,
    NegotiationRound   round,
    GapAssessment      assessment
) {}
