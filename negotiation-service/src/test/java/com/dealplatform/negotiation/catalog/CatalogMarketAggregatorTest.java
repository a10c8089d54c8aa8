package com.dealplatform.negotiation.catalog;

import com.dealplatform.common.model.MarketSnapshotKey;
import com.dealplatform.common.model.Vehicle;
import com.dealplatform.negotiation.NegotiationFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CatalogMarketAggregatorTest {

    private final Catalog catalog = mock(Catalog.class);
    private final CatalogMarketAggregator aggregator = new CatalogMarketAggregator(catalog);
    private final MarketSnapshotKey segment = NegotiationFixtures.target().segment();

    private static Vehicle listedAt(double marketValue) {
        Vehicle v = NegotiationFixtures.target();
        return new Vehicle(v.id(), v.vin(), v.make(), v.model(), v.year(), v.version(), v.fuel(),
            v.transmission(), v.mileage(), v.powerHp(), v.condition(), marketValue, v.costBasis(), v.inStock());
    }

    @Test
    @DisplayName("catalog listings of the segment are summarised")
    void summarisesSegment() {
        when(catalog.findBySegment(segment)).thenReturn(Flux.just(listedAt(30_000), listedAt(32_000), listedAt(34_000)));

        StepVerifier.create(aggregator.aggregate(segment))
            .assertNext(stats -> {
                assertEquals(32_000, stats.avgPrice(), 1e-9);
                assertEquals(30_000, stats.minPrice(), 1e-9);
                assertEquals(34_000, stats.maxPrice(), 1e-9);
                assertEquals(3, stats.listingCount());
                assertEquals(0.3, stats.confidence(), 1e-9);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("a segment with no listings fails")
    void emptySegment() {
        when(catalog.findBySegment(segment)).thenReturn(Flux.empty());

        StepVerifier.create(aggregator.aggregate(segment))
            .expectError(IllegalStateException.class)
            .verify();
    }
}
