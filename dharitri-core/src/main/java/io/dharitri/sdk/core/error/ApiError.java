// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.error;

import java.util.Locale;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Structured description of a failed gateway interaction.
 *
 * <p>Once constructed an {@code ApiError} is reported to the caller, never
 * retried internally. It travels inside an {@link ApiException}.
 *
 * @param kind         the failure classification
 * @param message      human-readable reason, decoded from the node payload when present
 * @param code         node-provided error code (e.g. {@code "invalid_transaction"}), if any
 * @param httpStatus   HTTP status of the response, or {@code 0} when no response was received
 * @param nodeReported whether message and code were decoded from a well-formed gateway error envelope
 * @since 0.1.0
 */
public record ApiError(
        ApiErrorKind kind,
        String message,
        @Nullable String code,
        int httpStatus,
        boolean nodeReported) {

    public ApiError {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
        code = code == null || code.isBlank() ? null : code;
    }

    /** An error not produced by the node itself. */
    public ApiError(final ApiErrorKind kind, final String message, final @Nullable String code, final int httpStatus) {
        this(kind, message, code, httpStatus, false);
    }

    public static ApiError of(final ApiErrorKind kind, final String message) {
        return new ApiError(kind, message, null, 0);
    }

    /**
     * Returns whether the node answered that the requested entity does not exist.
     *
     * <p>Gateways answer {@code 404 {"error":"transaction not found"}} for a
     * transaction that is still propagating, so callers tracking a fresh
     * broadcast treat this as pending rather than fatal. A 404 that does not
     * carry a gateway error envelope (wrong base URL, an unrouted path, a
     * front proxy's error page) is not the node speaking and does not count.
     *
     * @return {@code true} for a fatal node error whose message or code says "not found"
     */
    public boolean isNotFound() {
        if (kind != ApiErrorKind.FATAL || !nodeReported) {
            return false;
        }
        return message.toLowerCase(Locale.ROOT).contains("not found")
                || (code != null && code.toLowerCase(Locale.ROOT).contains("not_found"));
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("ApiError{kind=").append(kind);
        if (httpStatus != 0) {
            sb.append(", httpStatus=").append(httpStatus);
        }
        if (code != null) {
            sb.append(", code=").append(code);
        }
        return sb.append(", message=").append(message).append('}').toString();
    }
}
