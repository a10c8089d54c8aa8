package com.dealplatform.agents.support;

import com.dealplatform.common.model.ClientProfile;
import com.dealplatform.common.model.MarketSnapshot;
import com.dealplatform.common.model.Vehicle;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Fragments shared by the role context documents, so every role sees a vehicle, a market
 * and a client under the same field names.
 */
public final class ContextJson {

    private ContextJson() {}

    public static ObjectNode vehicle(ObjectMapper mapper, Vehicle vehicle) {
        ObjectNode node = mapper.createObjectNode();
        node.put("make",         vehicle.make());
        node.put("model",        vehicle.model());
        node.put("year",         vehicle.year());
        node.put("version",      vehicle.version());
        node.put("fuel",         vehicle.fuel().name());
        node.put("transmission", vehicle.transmission().name());
        node.put("mileage",      vehicle.mileage());
        node.put("powerHp",      vehicle.powerHp());
        node.put("condition",    vehicle.condition().name());
        node.put("marketValue",  vehicle.marketValue());
        return node;
    }

    public static ObjectNode market(ObjectMapper mapper, MarketSnapshot snapshot) {
        ObjectNode node = mapper.createObjectNode();
        node.put("segment",      snapshot.key().toString());
        node.put("avgPrice",     snapshot.avgPrice());
        node.put("minPrice",     snapshot.minPrice());
        node.put("maxPrice",     snapshot.maxPrice());
        node.put("listingCount", snapshot.listingCount());
        node.put("confidence",   snapshot.confidence());
        node.put("degraded",     snapshot.degraded());
        return node;
    }

    public static ObjectNode client(ObjectMapper mapper, ClientProfile client) {
        ObjectNode node = mapper.createObjectNode();
        node.put("budgetMin",       client.budgetMin());
        node.put("budgetMax",       client.budgetMax());
        node.put("offerPreference", client.offerPreference().name());
        node.put("loyaltyScore",    client.loyaltyScore());
        node.put("riskScore",       client.riskScore());
        return node;
    }
}
