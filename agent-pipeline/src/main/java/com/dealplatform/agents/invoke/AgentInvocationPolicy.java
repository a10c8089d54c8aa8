package com.dealplatform.agents.invoke;

import java.time.Duration;

/**
 * Per-attempt timeout and retry budget applied uniformly to every agent role.
 *
 * @param timeout     upper bound on a single backend attempt
 * @param maxAttempts total attempts including the first, at least 1
 * @param backoff     first retry delay; grows exponentially with jitter
 */
public record AgentInvocationPolicy(
    Duration timeout,
    int      maxAttempts,
    Duration backoff
) {

    public AgentInvocationPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
    }
}
