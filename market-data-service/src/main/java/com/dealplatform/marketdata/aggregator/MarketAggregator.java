package com.dealplatform.marketdata.aggregator;

import com.dealplatform.common.model.MarketSnapshotKey;
import com.dealplatform.common.model.MarketStats;
import reactor.core.publisher.Mono;

/**
 * Source of aggregated listing statistics for a market segment. Raw collection from
 * listing sites lives behind this interface; the cache only sees the aggregate.
 *
 * <p>May fail with any transient source error. {@link com.dealplatform.marketdata.cache.MarketSnapshotCache}
 * decides whether that degrades or blocks.
 */
public interface MarketAggregator {
    Mono<MarketStats> aggregate(MarketSnapshotKey key);
}
