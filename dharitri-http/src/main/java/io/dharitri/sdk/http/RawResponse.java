// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.util.Objects;

/**
 * An HTTP response as received, before any envelope decoding.
 *
 * @param statusCode HTTP status code
 * @param body       response body (empty when the server sent none)
 */
public record RawResponse(int statusCode, String body) {

    public RawResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public static RawResponse of(final int statusCode, final String body) {
        return new RawResponse(statusCode, Objects.requireNonNullElse(body, ""));
    }
}
