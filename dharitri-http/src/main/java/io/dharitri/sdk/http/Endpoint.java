// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.util.Objects;

/**
 * A resolved gateway endpoint: method plus concrete path (query string included).
 *
 * @param operation the logical operation
 * @param method    the HTTP method
 * @param path      path relative to the gateway base URL, starting with {@code /}
 */
public record Endpoint(Operation operation, HttpMethod method, String path) {

    public Endpoint {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/', got: " + path);
        }
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
