package com.dealplatform.negotiation.session;

/**
 * Distance between what the client expects and the offer on the table.
 *
 * @param expectation client's expected transaction value, {@code null} when none could be read
 * @param gap         relative distance in [0, 1]
 * @param converged   {@code gap} is within the acceptance threshold
 */
public record GapAssessment(
    Double            expectation,
    ExpectationSource source,
    double            gap,
    boolean           converged
) {}
