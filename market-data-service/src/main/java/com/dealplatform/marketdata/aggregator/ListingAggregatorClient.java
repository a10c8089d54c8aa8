package com.dealplatform.marketdata.aggregator;

import com.dealplatform.common.model.MarketSnapshotKey;
import com.dealplatform.common.model.MarketStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * {@link MarketAggregator} backed by the listing-aggregation service over HTTP.
 *
 * <p>{@code GET /api/v1/listings/aggregate?make=&model=&year=&fuel=} answers with
 * {@code {avgPrice, minPrice, maxPrice, listingCount, confidence}}. Selected with
 * {@code market-data.aggregator.source=http}.
 */
@Component
@ConditionalOnProperty(name = "market-data.aggregator.source", havingValue = "http")
public class ListingAggregatorClient implements MarketAggregator {

    private static final Logger log = LoggerFactory.getLogger(ListingAggregatorClient.class);

    private final WebClient listingAggregatorWebClient;

    public ListingAggregatorClient(WebClient listingAggregatorWebClient) {
        this.listingAggregatorWebClient = listingAggregatorWebClient;
    }

    @Override
    public Mono<MarketStats> aggregate(MarketSnapshotKey key) {
        log.info("Aggregating listings. segment={}", key);
        return listingAggregatorWebClient.get()
            .uri(uri -> uri.path("/api/v1/listings/aggregate")
                .queryParam("make", key.make())
                .queryParam("model", key.model())
                .queryParam("year", key.year())
                .queryParam("fuel", key.fuel().name())
                .build())
            .retrieve()
            .bodyToMono(MarketStats.class)
            .doOnSuccess(stats -> log.info("Listings aggregated. segment={} listingCount={} avgPrice={}",
                key, stats != null ? stats.listingCount() : 0, stats != null ? stats.avgPrice() : 0.0))
            .doOnError(e -> log.warn("Listing aggregation failed. segment={} reason={}", key, e.getMessage()));
    }
}
