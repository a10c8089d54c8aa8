package com.dealplatform.negotiation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class NegotiationConfig {

    @Value("${negotiation.max-rounds:10}")
    private int maxRounds;

    @Value("${negotiation.acceptance-threshold:0.02}")
    private double acceptanceThreshold;

    @Value("${negotiation.session-timeout:PT300S}")
    private Duration sessionTimeout;

    @Value("${negotiation.default-margin-target:0.15}")
    private double defaultMarginTarget;

    @Bean
    public NegotiationPolicy negotiationPolicy() {
        return new NegotiationPolicy(maxRounds, acceptanceThreshold, sessionTimeout, defaultMarginTarget);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
