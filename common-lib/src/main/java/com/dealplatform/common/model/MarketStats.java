package com.dealplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw aggregate returned by the market aggregator for one segment.
 */
public record MarketStats(
    @JsonProperty("avgPrice")     double avgPrice,
    @JsonProperty("minPrice")     double minPrice,
    @JsonProperty("maxPrice")     double maxPrice,
    @JsonProperty("listingCount") int listingCount,
    @JsonProperty("confidence")   double confidence
) {}
