package com.dealplatform.common.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Aggregated pricing statistics for one market segment at {@code computedAt}.
 *
 * <p>{@code degraded} is set only on the copy handed out after a failed recomputation;
 * the stored snapshot itself is never flagged.
 */
public record MarketSnapshot(
    MarketSnapshotKey key,
    double            avgPrice,
    double            minPrice,
    double            maxPrice,
    int               listingCount,
    double            confidence,
    Instant           computedAt,
    boolean           degraded
) {

    public static MarketSnapshot of(MarketSnapshotKey key, MarketStats stats, Instant computedAt) {
        return new MarketSnapshot(key, stats.avgPrice(), stats.minPrice(), stats.maxPrice(),
                                  stats.listingCount(), stats.confidence(), computedAt, false);
    }

    /** Stale once its age reaches the TTL. */
    public boolean isStale(Instant now, Duration ttl) {
        return !now.isBefore(computedAt.plus(ttl));
    }

    public MarketSnapshot asDegraded() {
        return new MarketSnapshot(key, avgPrice, minPrice, maxPrice, listingCount,
                                  confidence, computedAt, true);
    }
}
