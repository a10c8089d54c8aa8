package com.dealplatform.agents.support;

import com.dealplatform.common.agent.AgentRole;
import com.dealplatform.common.exception.MalformedAgentOutputException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Required-field accessors for agent output. Every accessor either returns a value that
 * satisfies the declared type and range or throws {@link MalformedAgentOutputException};
 * nothing is defaulted.
 */
public final class OutputSchema {

    private OutputSchema() {}

    public static JsonNode requireObject(AgentRole role, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw new MalformedAgentOutputException(role, "missing object field '" + field + "'");
        }
        return value;
    }

    public static String requireText(AgentRole role, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new MalformedAgentOutputException(role, "missing text field '" + field + "'");
        }
        return value.asText();
    }

    public static double requireNumber(AgentRole role, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber() || !Double.isFinite(value.asDouble())) {
            throw new MalformedAgentOutputException(role, "missing numeric field '" + field + "'");
        }
        return value.asDouble();
    }

    public static double requireNonNegative(AgentRole role, JsonNode node, String field) {
        double value = requireNumber(role, node, field);
        if (value < 0) {
            throw new MalformedAgentOutputException(role, "field '" + field + "' is negative: " + value);
        }
        return value;
    }

    /** A score in [0, 1]. */
    public static double requireScore(AgentRole role, JsonNode node, String field) {
        double value = requireNumber(role, node, field);
        if (value < 0.0 || value > 1.0) {
            throw new MalformedAgentOutputException(role, "field '" + field + "' out of range [0,1]: " + value);
        }
        return value;
    }

    public static int requireInt(AgentRole role, JsonNode node, String field, int min, int max) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new MalformedAgentOutputException(role, "missing integer field '" + field + "'");
        }
        int v = value.asInt();
        if (v < min || v > max) {
            throw new MalformedAgentOutputException(role,
                "field '" + field + "' out of range [" + min + "," + max + "]: " + v);
        }
        return v;
    }

    public static boolean optionalFlag(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() && value.asBoolean();
    }

    public static <E extends Enum<E>> E requireEnum(AgentRole role, JsonNode node, String field, Class<E> type) {
        String raw = requireText(role, node, field);
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedAgentOutputException(role,
                "field '" + field + "' has unknown " + type.getSimpleName() + " value '" + raw + "'");
        }
    }

    public static List<String> requireTextList(AgentRole role, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new MalformedAgentOutputException(role, "missing array field '" + field + "'");
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new MalformedAgentOutputException(role, "array '" + field + "' holds a non-text element");
            }
            items.add(item.asText());
        }
        return items;
    }
}
