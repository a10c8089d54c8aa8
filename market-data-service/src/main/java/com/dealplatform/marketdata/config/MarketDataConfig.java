package com.dealplatform.marketdata.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class MarketDataConfig {

    @Value("${market-data.aggregator.base-url:http://localhost:8090}")
    private String aggregatorBaseUrl;

    @Bean
    public WebClient listingAggregatorWebClient(WebClient.Builder builder) {
        return builder.baseUrl(aggregatorBaseUrl).build();
    }
}
