package com.dealplatform.negotiation.config;

import java.time.Duration;

/**
 * Session limits and convergence settings shared by every negotiation.
 *
 * <ul>
 *   <li>{@code maxRounds}           hard cap on recorded rounds</li>
 *   <li>{@code acceptanceThreshold} gap at or under which a round moves to pending approval</li>
 *   <li>{@code sessionTimeout}      wall-clock limit measured from {@code startedAt}</li>
 *   <li>{@code defaultMarginTarget} used when initiation does not name one</li>
 * </ul>
 */
public record NegotiationPolicy(
    int      maxRounds,
    double   acceptanceThreshold,
    Duration sessionTimeout,
    double   defaultMarginTarget
) {

    public static final double MAX_MARGIN_TARGET = 0.9;

    public NegotiationPolicy {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be >= 1, got " + maxRounds);
        }
        if (acceptanceThreshold < 0 || acceptanceThreshold > 1) {
            throw new IllegalArgumentException("acceptanceThreshold must be in [0,1], got " + acceptanceThreshold);
        }
        if (defaultMarginTarget < 0 || defaultMarginTarget > MAX_MARGIN_TARGET) {
            throw new IllegalArgumentException("defaultMarginTarget must be in [0," + MAX_MARGIN_TARGET + "]");
        }
    }
}
