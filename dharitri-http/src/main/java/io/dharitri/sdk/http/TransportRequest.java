// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A single HTTP request handed to an {@link HttpTransport}.
 *
 * @param method  the HTTP method
 * @param uri     absolute request URI
 * @param body    already-serialized JSON body, or {@code null} for none
 * @param timeout request timeout (must be positive)
 * @param headers extra request headers
 */
public record TransportRequest(
        HttpMethod method,
        URI uri,
        byte @Nullable [] body,
        Duration timeout,
        Map<String, String> headers) {

    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
        }
        if (method == HttpMethod.GET && body != null) {
            throw new IllegalArgumentException("GET requests cannot carry a body");
        }
        body = body == null ? null : body.clone();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportRequest get(final URI uri, final Duration timeout) {
        return new TransportRequest(HttpMethod.GET, uri, null, timeout, Map.of());
    }

    public static TransportRequest post(final URI uri, final byte @Nullable [] body, final Duration timeout) {
        return new TransportRequest(HttpMethod.POST, uri, body, timeout, Map.of());
    }

    /** Returns a copy of the body, or {@code null} when there is none. */
    @Override
    public byte @Nullable [] body() {
        return body == null ? null : body.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransportRequest other)) {
            return false;
        }
        return method == other.method
                && uri.equals(other.uri)
                && Arrays.equals(body, other.body)
                && timeout.equals(other.timeout)
                && headers.equals(other.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, uri, Arrays.hashCode(body), timeout, headers);
    }

    @Override
    public String toString() {
        return "TransportRequest{" + method + " " + uri
                + ", bodyBytes=" + (body == null ? 0 : body.length)
                + ", timeout=" + timeout + "}";
    }
}
