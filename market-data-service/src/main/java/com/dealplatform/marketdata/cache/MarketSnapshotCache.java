package com.dealplatform.marketdata.cache;

import com.dealplatform.common.exception.MarketDataUnavailableException;
import com.dealplatform.common.model.MarketSnapshot;
import com.dealplatform.common.model.MarketSnapshotKey;
import com.dealplatform.common.model.MarketStats;
import com.dealplatform.common.model.Vehicle;
import com.dealplatform.marketdata.aggregator.MarketAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL cache of {@link MarketSnapshot}s, one per (make, model, year, fuel) segment.
 *
 * <p><strong>Fetch once, serve many:</strong> a fresh snapshot is returned as-is, without
 * touching the aggregator. A missing or stale one is recomputed, and at most one
 * recomputation per segment is in flight: concurrent callers share the same cached
 * {@link Mono} from {@link #inFlight}.
 *
 * <p>Recomputation is bounded by {@code market-data.aggregation-timeout}. A timed-out or
 * failed aggregation stores nothing. The caller then receives the last known snapshot
 * flagged {@code degraded}, or {@link MarketDataUnavailableException} when the segment was
 * never computed.
 */
@Component
public class MarketSnapshotCache {

    private static final Logger log = LoggerFactory.getLogger(MarketSnapshotCache.class);

    private final MarketAggregator aggregator;
    private final Clock clock;
    private final Duration ttl;
    private final Duration aggregationTimeout;

    private final ConcurrentHashMap<MarketSnapshotKey, MarketSnapshot> store = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<MarketSnapshotKey, Mono<MarketSnapshot>> inFlight = new ConcurrentHashMap<>();

    public MarketSnapshotCache(MarketAggregator aggregator,
                               Clock clock,
                               @Value("${market-data.snapshot-ttl:PT24H}") Duration ttl,
                               @Value("${market-data.aggregation-timeout:PT10S}") Duration aggregationTimeout) {
        this.aggregator         = aggregator;
        this.clock              = clock;
        this.ttl                = ttl;
        this.aggregationTimeout = aggregationTimeout;
    }

    public Mono<MarketSnapshot> get(Vehicle vehicle) {
        return get(vehicle.segment());
    }

    public Mono<MarketSnapshot> get(MarketSnapshotKey key) {
        return Mono.defer(() -> {
            MarketSnapshot cached = store.get(key);
            if (cached != null && !cached.isStale(clock.instant(), ttl)) {
                log.info("CACHE_HIT segment={} computedAt={}", key, cached.computedAt());
                return Mono.just(cached);
            }
            if (cached != null) {
                log.info("CACHE_STALE segment={} computedAt={} ttlHours={}", key, cached.computedAt(), ttl.toHours());
            } else {
                log.info("CACHE_MISS segment={}", key);
            }
            return inFlight.computeIfAbsent(key, this::recompute);
        });
    }

    /** Last stored snapshot for the segment, fresh or not. Never triggers aggregation. */
    public Optional<MarketSnapshot> peek(MarketSnapshotKey key) {
        return Optional.ofNullable(store.get(key));
    }

    public void invalidate(MarketSnapshotKey key) {
        store.remove(key);
        log.info("CACHE_INVALIDATED segment={}", key);
    }

    // ── recomputation ────────────────────────────────────────────────────────

    /**
     * Builds the shared recomputation for {@code key}. The store is re-checked on
     * subscription: a caller that lost the race against a just-finished recomputation
     * gets the fresh result instead of a second aggregation call.
     */
    private Mono<MarketSnapshot> recompute(MarketSnapshotKey key) {
        return Mono.defer(() -> {
                MarketSnapshot current = store.get(key);
                if (current != null && !current.isStale(clock.instant(), ttl)) {
                    return Mono.just(current);
                }
                return aggregator.aggregate(key)
                    .switchIfEmpty(Mono.error(new IllegalStateException("aggregator returned no data")))
                    .timeout(aggregationTimeout)
                    .map(stats -> MarketSnapshot.of(key, validated(key, stats), clock.instant()))
                    .doOnNext(snapshot -> {
                        store.put(key, snapshot);
                        log.info("CACHE_REFRESH segment={} avgPrice={} listingCount={} confidence={}",
                                 key, snapshot.avgPrice(), snapshot.listingCount(), snapshot.confidence());
                    });
            })
            .onErrorResume(e -> degrade(key, e))
            .doOnTerminate(() -> inFlight.remove(key))
            .cache();
    }

    private Mono<MarketSnapshot> degrade(MarketSnapshotKey key, Throwable cause) {
        MarketSnapshot last = store.get(key);
        if (last == null) {
            log.error("CACHE_UNAVAILABLE segment={} reason={}", key, cause.getMessage());
            return Mono.error(new MarketDataUnavailableException(key, cause));
        }
        log.warn("CACHE_DEGRADED segment={} servingComputedAt={} reason={}",
                 key, last.computedAt(), cause.getMessage());
        return Mono.just(last.asDegraded());
    }

    private static MarketStats validated(MarketSnapshotKey key, MarketStats stats) {
        boolean ordered = stats.minPrice() <= stats.avgPrice() && stats.avgPrice() <= stats.maxPrice();
        if (stats.minPrice() < 0 || !ordered || stats.listingCount() < 0
                || stats.confidence() < 0 || stats.confidence() > 1) {
            throw new IllegalArgumentException("Inconsistent aggregate for segment=" + key + ": " + stats);
        }
        return stats;
    }
}
