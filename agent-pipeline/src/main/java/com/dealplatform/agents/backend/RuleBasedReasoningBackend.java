package com.dealplatform.agents.backend;

import com.dealplatform.agents.support.OfferTermsJson;
import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.agent.DemandLevel;
import com.dealplatform.common.agent.PricingPosition;
import com.dealplatform.common.agent.ReasoningBackend;
import com.dealplatform.common.agent.RecommendedAction;
import com.dealplatform.common.agent.TradeInEvaluation;
import com.dealplatform.common.model.FeedbackSignals;
import com.dealplatform.common.model.OfferTerms;
import com.dealplatform.common.model.OfferType;
import com.dealplatform.common.model.VehicleCondition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic heuristics for every role, answering in the same JSON shapes a language
 * model is asked for. Used when no model API key is configured, and as the reference
 * behaviour in tests.
 */
public class RuleBasedReasoningBackend implements ReasoningBackend {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedReasoningBackend.class);

    // Market analysis
    static final int    SCARCE_LISTINGS       = 15;
    static final int    CROWDED_LISTINGS      = 50;
    static final double POSITION_BAND         = 0.03;
    static final double LOW_CONFIDENCE        = 0.5;

    // Trade-in
    static final double RESALE_FACTOR         = 0.85;
    static final int    EXPECTED_KM_PER_YEAR  = 15_000;
    static final double EXCESS_KM_PENALTY     = 0.10;   // per 100 000 km over expectation
    static final double MIN_MILEAGE_FACTOR    = 0.70;
    static final double LOYALTY_BONUS_RATE    = 0.02;
    static final double DEGRADED_CONFIDENCE   = 0.8;

    // Offer structuring
    static final int    PURCHASE_WARRANTY     = 24;
    static final int    LEASE_MONTHS          = 36;
    static final int    SUBSCRIPTION_MONTHS   = 24;
    static final double SUBSCRIPTION_PREMIUM  = 0.06;

    // Negotiation
    static final double FINAL_EFFORT_RATE     = 0.8;
    static final double PUSHBACK_STEP         = 0.03;
    static final double LIKELIHOOD_SLOPE      = 4.0;

    private final ObjectMapper objectMapper;

    public RuleBasedReasoningBackend(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() { return "rule-based"; }

    @Override
    public Mono<JsonNode> invoke(AgentRole role, JsonNode context) {
        return Mono.fromCallable(() -> {
            log.debug("[RuleBasedBackend] role={}", role);
            return switch (role) {
                case MARKET_ANALYSIS     -> marketAnalysis(context);
                case TRADE_IN_EVALUATION -> tradeInEvaluation(context);
                case OFFER_STRUCTURING   -> offerStructuring(context);
                case NEGOTIATION         -> negotiation(context);
            };
        });
    }

    // ── Market analysis ──────────────────────────────────────────────────────

    JsonNode marketAnalysis(JsonNode context) {
        JsonNode vehicle = context.path("vehicle");
        JsonNode market  = context.path("market");
        int    listings  = market.path("listingCount").asInt();
        double avg       = market.path("avgPrice").asDouble();
        double value     = vehicle.path("marketValue").asDouble();
        boolean degraded = market.path("degraded").asBoolean();

        DemandLevel demand = listings < SCARCE_LISTINGS ? DemandLevel.HIGH
                           : listings < CROWDED_LISTINGS ? DemandLevel.MEDIUM
                           : DemandLevel.LOW;
        PricingPosition position = value > avg * (1 + POSITION_BAND) ? PricingPosition.ABOVE_MARKET
                                 : value < avg * (1 - POSITION_BAND) ? PricingPosition.BELOW_MARKET
                                 : PricingPosition.AT_MARKET;

        List<String> factors = new ArrayList<>();
        factors.add(listings + " comparable listings in segment " + market.path("segment").asText());
        factors.add(String.format("Segment price band %.0f to %.0f, average %.0f",
            market.path("minPrice").asDouble(), market.path("maxPrice").asDouble(), avg));
        factors.add(vehicle.path("mileage").asInt() + " km, condition " + vehicle.path("condition").asText());

        List<String> risks = new ArrayList<>();
        if (market.path("confidence").asDouble() < LOW_CONFIDENCE) risks.add("Low confidence in market statistics");
        if (degraded)                                              risks.add("Market snapshot is stale; prices may have moved");
        if (position == PricingPosition.ABOVE_MARKET)              risks.add("Listed above segment average");
        if (demand == DemandLevel.LOW)                             risks.add("Crowded segment gives the client alternatives");

        String strategy = switch (demand) {
            case HIGH   -> position == PricingPosition.BELOW_MARKET
                ? "Scarce segment priced below average: hold price firmly"
                : "Scarce segment: hold price, concede on services before price";
            case MEDIUM -> "Balanced segment: anchor at list price, concede gradually";
            case LOW    -> position == PricingPosition.ABOVE_MARKET
                ? "Crowded segment priced above average: expect early price concessions"
                : "Crowded segment: compete on bundled services and trade-in value";
        };

        ObjectNode out = objectMapper.createObjectNode();
        out.put("demandLevel", demand.name());
        out.put("pricingPosition", position.name());
        ArrayNode competitive = out.putArray("competitiveFactors");
        factors.forEach(competitive::add);
        out.put("recommendedStrategy", strategy);
        ArrayNode riskArray = out.putArray("riskFactors");
        risks.forEach(riskArray::add);
        return out;
    }

    // ── Trade-in evaluation ──────────────────────────────────────────────────

    JsonNode tradeInEvaluation(JsonNode context) {
        JsonNode vehicle = context.path("vehicle");
        JsonNode market  = context.path("market");
        JsonNode client  = context.path("client");

        int age          = Math.max(0, context.path("referenceYear").asInt() - vehicle.path("year").asInt());
        int mileage      = vehicle.path("mileage").asInt();
        int excessKm     = Math.max(0, mileage - age * EXPECTED_KM_PER_YEAR);
        double mileageFactor = Math.max(MIN_MILEAGE_FACTOR, 1.0 - excessKm / 100_000.0 * EXCESS_KM_PENALTY);

        VehicleCondition condition = VehicleCondition.valueOf(vehicle.path("condition").asText());
        double loyalty   = client.path("loyaltyScore").asDouble();

        double baseValue           = cents(market.path("avgPrice").asDouble() * RESALE_FACTOR * mileageFactor);
        double conditionAdjustment = cents(baseValue * condition.valueFactor());
        double loyaltyBonus        = cents(baseValue * LOYALTY_BONUS_RATE * loyalty);
        double finalValue          = TradeInEvaluation.expectedFinalValue(baseValue, conditionAdjustment, loyaltyBonus);

        double confidence = market.path("confidence").asDouble();
        if (market.path("degraded").asBoolean()) {
            confidence *= DEGRADED_CONFIDENCE;
        }

        ObjectNode out = objectMapper.createObjectNode();
        out.put("baseValue", baseValue);
        out.put("conditionAdjustment", conditionAdjustment);
        out.put("loyaltyBonus", loyaltyBonus);
        out.put("finalValue", finalValue);
        out.put("confidence", clamp(confidence));
        out.put("justification", String.format(
            "Resale estimate %.0f from segment average (%d km, %d years), %s condition %+.0f, loyalty bonus %.0f",
            baseValue, mileage, age, condition.name().toLowerCase(), conditionAdjustment, loyaltyBonus));
        return out;
    }

    // ── Offer structuring ────────────────────────────────────────────────────

    JsonNode offerStructuring(JsonNode context) {
        JsonNode client  = context.path("client");
        JsonNode vehicle = context.path("vehicle");
        double tradeIn   = context.path("tradeInValue").asDouble();
        double floor     = context.path("marginFloor").asDouble();
        double ceiling   = client.path("budgetMax").asDouble() + tradeIn;
        double listPrice = Math.max(vehicle.path("marketValue").asDouble(), floor);

        boolean conflict = floor > ceiling;
        double price = conflict ? floor : Math.min(listPrice, ceiling);

        ObjectNode out = objectMapper.createObjectNode();
        ArrayNode offers = out.putArray("offers");
        int index = 0;
        for (JsonNode typeNode : context.path("offerTypes")) {
            if (index == 3) break;
            OfferType type = OfferType.valueOf(typeNode.asText());
            double confidence = (0.8 - 0.1 * index) * (conflict ? 0.6 : 1.0);
            offers.add(OfferTermsJson.write(objectMapper, candidate(type, price, ceiling, tradeIn, conflict, confidence)));
            index++;
        }
        out.put("constraintConflict", conflict);
        if (conflict) {
            out.put("conflictReason", String.format(
                "Margin floor %.2f exceeds the most the budget allows (%.2f including trade-in); budget gave way",
                floor, ceiling));
        }
        return out;
    }

    private OfferTerms candidate(OfferType type, double price, double ceiling, double tradeIn,
                                 boolean conflict, double confidence) {
        return switch (type) {
            case PURCHASE -> OfferTerms.purchase(ceilCents(price), tradeIn, PURCHASE_WARRANTY,
                String.format("Purchase at %.0f with %d months warranty", price, PURCHASE_WARRANTY), confidence);
            case LEASE -> OfferTerms.monthly(OfferType.LEASE, ceilCents(price / LEASE_MONTHS), LEASE_MONTHS, tradeIn,
                String.format("Lease over %d months, total %.0f", LEASE_MONTHS, price), confidence);
            case SUBSCRIPTION -> {
                double withServices = conflict ? price : Math.max(price, Math.min(price * (1 + SUBSCRIPTION_PREMIUM), ceiling));
                yield OfferTerms.monthly(OfferType.SUBSCRIPTION, ceilCents(withServices / SUBSCRIPTION_MONTHS),
                    SUBSCRIPTION_MONTHS, tradeIn,
                    String.format("All-inclusive subscription over %d months, total %.0f", SUBSCRIPTION_MONTHS, withServices),
                    confidence);
            }
        };
    }

    // ── Negotiation ──────────────────────────────────────────────────────────

    JsonNode negotiation(JsonNode context) {
        OfferTerms current   = OfferTermsJson.read(AgentRole.NEGOTIATION, context.path("currentOffer"));
        JsonNode client      = context.path("client");
        String feedback      = context.path("feedback").asText("");
        double costBasis     = context.path("costBasis").asDouble();
        double marginTarget  = context.path("marginTarget").asDouble();
        boolean finalEffort  = context.path("finalEffort").asBoolean();

        double currentPrice  = current.effectivePrice();
        double floor         = costBasis / (1.0 - marginTarget);
        // concessions never give away more than half the target margin
        double hardFloor     = costBasis / (1.0 - marginTarget / 2.0);

        Optional<Double> expected = context.path("counterProposal").has("expectedPrice")
            ? Optional.of(context.path("counterProposal").path("expectedPrice").asDouble())
            : FeedbackSignals.extractPrice(feedback);

        ObjectNode out = objectMapper.createObjectNode();

        if (expected.isPresent()) {
            double ask = expected.get();
            if (ask >= currentPrice - 0.5) {
                return advice(out, null, 0.95, RecommendedAction.ACCEPT,
                    String.format("Client expectation %.0f meets the current price %.0f", ask, currentPrice));
            }
            double rate = finalEffort
                ? FINAL_EFFORT_RATE
                : 0.5 - 0.25 * client.path("riskScore").asDouble() + 0.1 * client.path("loyaltyScore").asDouble();
            double target = Math.max(hardFloor, currentPrice - (currentPrice - ask) * rate);
            if (target >= currentPrice - 1.0) {
                double gap = (currentPrice - ask) / currentPrice;
                return advice(out, null, clamp(1 - gap * LIKELIHOOD_SLOPE, 0.05, 0.9), RecommendedAction.HOLD_FIRM,
                    String.format("Current price %.0f is already at the concession floor; client asks %.0f", currentPrice, ask));
            }
            OfferTerms revised = reprice(current, target, floor,
                String.format("Moved from %.0f toward client expectation %.0f", currentPrice, ask));
            double remaining = (revised.effectivePrice() - ask) / revised.effectivePrice();
            return advice(out, revised, clamp(1 - remaining * LIKELIHOOD_SLOPE, 0.05, 0.95),
                finalEffort ? RecommendedAction.CLOSE : RecommendedAction.ADJUST,
                String.format("Conceding %.0f of a %.0f gap%s", currentPrice - revised.effectivePrice(),
                    currentPrice - ask, finalEffort ? " as a final effort" : ""));
        }

        if (FeedbackSignals.isAgreement(feedback)) {
            return advice(out, null, 0.9, RecommendedAction.ACCEPT, "Client signals agreement with the current terms");
        }
        if (FeedbackSignals.isPushback(feedback)) {
            double target = Math.max(hardFloor, currentPrice * (1 - PUSHBACK_STEP));
            if (target < currentPrice - 1.0) {
                OfferTerms revised = reprice(current, target, floor, "Small gesture after price pushback");
                return advice(out, revised, 0.4, finalEffort ? RecommendedAction.CLOSE : RecommendedAction.ADJUST,
                    "Client pushes back without a figure; offering a small reduction");
            }
            return advice(out, null, 0.3, RecommendedAction.HOLD_FIRM, "Client pushes back but the price is at its floor");
        }
        return advice(out, null, 0.5, RecommendedAction.HOLD_FIRM, "No actionable signal in the feedback; holding terms");
    }

    private OfferTerms reprice(OfferTerms current, double target, double marginFloor, String justification) {
        OfferTerms revised = current.offerType().isMonthly()
            ? new OfferTerms(current.offerType(), current.tradeInValue(), null,
                ceilCents(target / current.durationMonths()), current.durationMonths(), current.warrantyMonths(),
                current.maintenanceIncluded(), current.roadsideAssistance(), current.insuranceIncluded(),
                justification, current.confidence(), false, false)
            : new OfferTerms(current.offerType(), current.tradeInValue(), ceilCents(target), null, null,
                current.warrantyMonths(), current.maintenanceIncluded(), current.roadsideAssistance(),
                current.insuranceIncluded(), justification, current.confidence(), false, false);
        return revised.effectivePrice() < marginFloor ? revised.asConcession() : revised;
    }

    private JsonNode advice(ObjectNode out, OfferTerms revised, double likelihood,
                            RecommendedAction action, String reasoning) {
        if (revised != null) {
            out.set("revisedOffer", OfferTermsJson.write(objectMapper, revised));
        } else {
            out.putNull("revisedOffer");
        }
        out.put("acceptanceLikelihood", likelihood);
        out.put("reasoning", reasoning);
        out.put("recommendedAction", action.name());
        return out;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static double cents(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    static double ceilCents(double value) {
        return Math.ceil(value * 100.0 - 1e-6) / 100.0;
    }

    private static double clamp(double value) {
        return clamp(value, 0.0, 1.0);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
