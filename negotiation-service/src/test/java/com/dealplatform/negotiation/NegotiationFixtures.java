package com.dealplatform.negotiation;

import com.dealplatform.common.agent.DemandLevel;
import com.dealplatform.common.agent.MarketAnalysis;
import com.dealplatform.common.agent.NegotiationAdvice;
import com.dealplatform.common.agent.OfferStructuringResult;
import com.dealplatform.common.agent.PricingPosition;
import com.dealplatform.common.agent.RecommendedAction;
import com.dealplatform.common.agent.TradeInEvaluation;
import com.dealplatform.common.model.ClientProfile;
import com.dealplatform.common.model.FuelType;
import com.dealplatform.common.model.MarketSnapshot;
import com.dealplatform.common.model.MarketStats;
import com.dealplatform.common.model.Negotiation;
import com.dealplatform.common.model.OfferPreference;
import com.dealplatform.common.model.OfferTerms;
import com.dealplatform.common.model.OfferType;
import com.dealplatform.common.model.Transmission;
import com.dealplatform.common.model.Vehicle;
import com.dealplatform.common.model.VehicleCondition;
import com.dealplatform.negotiation.config.NegotiationPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** Catalog rows and agent results shared by the negotiation tests. */
public final class NegotiationFixtures {

    public static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    public static final double COST_BASIS = 26_000;

    private NegotiationFixtures() {}

    public static NegotiationPolicy policy(int maxRounds) {
        return new NegotiationPolicy(maxRounds, 0.05, Duration.ofMinutes(30), 0.15);
    }

    public static Vehicle target() {
        return new Vehicle(1L, "VF3MCYHZRPS000001", "Peugeot", "3008", 2023, "GT BlueHDi 130",
            FuelType.DIESEL, Transmission.AUTOMATIC, 8_000, 130, VehicleCondition.EXCELLENT,
            32_000, COST_BASIS, true);
    }

    public static Vehicle tradeIn() {
        return new Vehicle(7L, "VF15RBJ0A60000007", "Renault", "Clio", 2018, "dCi 90",
            FuelType.DIESEL, Transmission.MANUAL, 120_000, 90, VehicleCondition.GOOD,
            11_000, 9_000, false);
    }

    public static ClientProfile client() {
        return new ClientProfile(1L, "Claire", "Martin", 25_000, 40_000, FuelType.DIESEL,
            Transmission.AUTOMATIC, OfferPreference.PURCHASE, 0.8, 0.2);
    }

    public static MarketSnapshot snapshot(Vehicle vehicle) {
        return MarketSnapshot.of(vehicle.segment(), new MarketStats(31_500, 28_000, 35_000, 42, 0.8), NOW);
    }

    public static MarketAnalysis analysis() {
        return new MarketAnalysis(DemandLevel.MEDIUM, PricingPosition.AT_MARKET,
            List.of("42 comparable listings"), "Anchor at list price, concede gradually", List.of());
    }

    public static OfferTerms purchase(double price) {
        return OfferTerms.purchase(price, 0.0, 24, "Purchase at " + price, 0.8);
    }

    public static OfferStructuringResult structuring() {
        return new OfferStructuringResult(
            List.of(purchase(32_000), OfferTerms.monthly(OfferType.LEASE, 888.89, 36, 0.0, "Lease", 0.7)),
            false, null);
    }

    public static NegotiationAdvice hold(double likelihood) {
        return new NegotiationAdvice(null, likelihood, "Holding terms", RecommendedAction.HOLD_FIRM);
    }

    public static NegotiationAdvice revise(OfferTerms revised, double likelihood) {
        return new NegotiationAdvice(revised, likelihood, "Moving toward the client", RecommendedAction.ADJUST);
    }

    public static Negotiation initiated(String id, int maxRounds) {
        return Negotiation.initiate(id, 1L, null, 1L, maxRounds, 0.15, COST_BASIS, NOW);
    }

    public static TradeInEvaluation noTradeIn() {
        return TradeInEvaluation.none();
    }

    /** Sequential ids "offer-1", "offer-2", ... */
    public static Supplier<String> offerIds() {
        AtomicInteger next = new AtomicInteger();
        return () -> "offer-" + next.incrementAndGet();
    }
}
