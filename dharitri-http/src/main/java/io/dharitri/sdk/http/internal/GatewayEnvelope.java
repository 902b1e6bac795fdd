// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http.internal;

import java.util.Locale;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import io.dharitri.sdk.core.InternalApi;
import io.dharitri.sdk.core.error.DecodeException;

/**
 * Parsed gateway response body.
 *
 * <p>
 * Gateways wrap results as {@code {"data":{...},"error":"","code":"successful"}}.
 * Some deployments and proxies in front of them return the payload object
 * directly, so the payload is {@code data} when present and the root object
 * otherwise.
 *
 * @param data  the payload object
 * @param error node error message, empty when none
 * @param code  node result code, or {@code null} when absent
 */
@InternalApi
public record GatewayEnvelope(JsonNode data, String error, @Nullable String code) {

    public static final String SUCCESS_CODE = "successful";

    public GatewayEnvelope {
        Objects.requireNonNull(data, "data");
        error = error == null ? "" : error;
    }

    /**
     * Parses a response body.
     *
     * @param body the raw body
     * @return the envelope
     * @throws DecodeException if the body is not a JSON object or {@code data},
     *                         {@code error} or {@code code} have the wrong type
     */
    public static GatewayEnvelope parse(final String body) {
        if (body == null || body.isBlank()) {
            throw new DecodeException("Empty response body");
        }
        final JsonNode root;
        try {
            root = GatewayJson.MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DecodeException("Response is not a JSON object");
        }
        final JsonNode data = root.get("data");
        final JsonNode payload;
        if (data == null || data.isNull()) {
            payload = root;
        } else if (data.isObject()) {
            payload = data;
        } else {
            throw new DecodeException("Field 'data' must be an object, got " + data.getNodeType());
        }
        return new GatewayEnvelope(payload, textField(root, "error"), textField(root, "code"));
    }

    private static @Nullable String textField(final JsonNode root, final String name) {
        final JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new DecodeException("Field '" + name + "' must be a string, got " + node.getNodeType());
        }
        return node.textValue();
    }

    /**
     * Returns whether the node reported a failure: a non-empty {@code error} or a
     * {@code code} other than {@value #SUCCESS_CODE}.
     */
    public boolean hasError() {
        return !error.isBlank()
                || (code != null && !code.isBlank() && !SUCCESS_CODE.equals(code.toLowerCase(Locale.ROOT)));
    }
}
