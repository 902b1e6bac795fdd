// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http.internal;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.dharitri.sdk.core.InternalApi;
import io.dharitri.sdk.core.error.DecodeException;

/**
 * Field accessors over gateway JSON payloads.
 *
 * <p>
 * Gateways are loose about number encoding: counters arrive either as JSON
 * numbers or as decimal strings, and network metrics use either a
 * {@code drt_} or a legacy {@code erd_} key prefix. These helpers absorb both
 * while still failing with {@link DecodeException} when a required field is
 * absent or has the wrong type.
 */
@InternalApi
public final class GatewayJson {

    /**
     * Shared, thread-safe mapper. Floats are read as {@code BigDecimal} so amounts
     * keep the exact text the node sent.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private static final String[] METRIC_PREFIXES = {"drt_", "erd_"};

    private GatewayJson() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns {@code parent.name} if it is a JSON object, otherwise {@code parent} itself.
     */
    public static JsonNode objectOrSelf(final JsonNode parent, final String name) {
        final JsonNode child = parent.get(name);
        return child != null && child.isObject() ? child : parent;
    }

    /**
     * Looks up a network metric under each known key prefix.
     *
     * @param node   the metrics object
     * @param suffix key without prefix, e.g. {@code "chain_id"}
     * @return the value, or {@code null} if absent under every prefix
     */
    public static @Nullable JsonNode metric(final JsonNode node, final String suffix) {
        for (String prefix : METRIC_PREFIXES) {
            final JsonNode value = node.get(prefix + suffix);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    public static String requireMetricText(final JsonNode node, final String suffix) {
        return asText(metric(node, suffix), "drt_" + suffix);
    }

    public static long requireMetricLong(final JsonNode node, final String suffix) {
        return asLong(metric(node, suffix), "drt_" + suffix);
    }

    public static long metricLong(final JsonNode node, final String suffix, final long fallback) {
        final JsonNode value = metric(node, suffix);
        return value == null ? fallback : asLong(value, "drt_" + suffix);
    }

    public static @Nullable String metricText(final JsonNode node, final String suffix) {
        final JsonNode value = metric(node, suffix);
        return value == null ? null : asText(value, "drt_" + suffix);
    }

    public static String requireText(final JsonNode node, final String field) {
        return asText(present(node, field), field);
    }

    public static @Nullable String optionalText(final JsonNode node, final String field) {
        final JsonNode value = present(node, field);
        if (value == null) {
            return null;
        }
        final String text = asText(value, field);
        return text.isEmpty() ? null : text;
    }

    public static long requireLong(final JsonNode node, final String field) {
        return asLong(present(node, field), field);
    }

    public static @Nullable Long optionalLong(final JsonNode node, final String field) {
        final JsonNode value = present(node, field);
        return value == null ? null : asLong(value, field);
    }

    public static List<JsonNode> array(final JsonNode node, final String field) {
        final JsonNode value = present(node, field);
        if (value == null) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new DecodeException("Field '" + field + "' must be an array, got " + value.getNodeType());
        }
        final List<JsonNode> items = new ArrayList<>(value.size());
        value.forEach(items::add);
        return items;
    }

    private static @Nullable JsonNode present(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value;
    }

    /**
     * Returns the exact text of a string or number node. Large amounts are never
     * routed through {@code double}.
     */
    private static String asText(final @Nullable JsonNode value, final String field) {
        if (value == null) {
            throw new DecodeException("Missing required field '" + field + "'");
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isIntegralNumber()) {
            return value.bigIntegerValue().toString();
        }
        if (value.isNumber()) {
            return value.decimalValue().toPlainString();
        }
        throw new DecodeException("Field '" + field + "' must be a string or number, got " + value.getNodeType());
    }

    private static long asLong(final @Nullable JsonNode value, final String field) {
        if (value == null) {
            throw new DecodeException("Missing required field '" + field + "'");
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.textValue().trim());
            } catch (NumberFormatException e) {
                throw new DecodeException("Field '" + field + "' is not an integer: " + value.textValue(), e);
            }
        }
        throw new DecodeException("Field '" + field + "' must be an integer, got " + value.getNodeType());
    }
}
