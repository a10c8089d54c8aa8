package com.dealplatform.negotiation.catalog;

import com.dealplatform.common.model.MarketSnapshotKey;
import com.dealplatform.common.model.MarketStats;
import com.dealplatform.common.model.Vehicle;
import com.dealplatform.marketdata.aggregator.MarketAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.DoubleSummaryStatistics;

/**
 * Segment statistics computed from the dealer's own catalog, for running without the
 * listing-aggregation service. Confidence grows with the number of catalog listings and
 * reaches 1 at {@link #FULL_CONFIDENCE_LISTINGS}.
 *
 * <p>Selected with {@code market-data.aggregator.source=catalog} (the default).
 */
@Component
@ConditionalOnProperty(name = "market-data.aggregator.source", havingValue = "catalog", matchIfMissing = true)
public class CatalogMarketAggregator implements MarketAggregator {

    private static final Logger log = LoggerFactory.getLogger(CatalogMarketAggregator.class);

    static final int FULL_CONFIDENCE_LISTINGS = 10;

    private final Catalog catalog;

    public CatalogMarketAggregator(Catalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Mono<MarketStats> aggregate(MarketSnapshotKey key) {
        return catalog.findBySegment(key)
            .map(Vehicle::marketValue)
            .collect(DoubleSummaryStatistics::new, DoubleSummaryStatistics::accept)
            .flatMap(stats -> {
                if (stats.getCount() == 0) {
                    return Mono.error(new IllegalStateException("no catalog listings for segment " + key));
                }
                int listings = (int) stats.getCount();
                double confidence = Math.min(1.0, (double) listings / FULL_CONFIDENCE_LISTINGS);
                log.info("Catalog segment aggregated. segment={} listingCount={} avgPrice={}",
                    key, listings, stats.getAverage());
                return Mono.just(new MarketStats(stats.getAverage(), stats.getMin(), stats.getMax(),
                                                 listings, confidence));
            });
    }
}
