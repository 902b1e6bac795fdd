// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.error;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a gateway operation fails.
 *
 * <p>
 * Every public gateway operation reports failures through this type; the
 * attached {@link ApiError} tells whether the failure was transient,
 * rate-limited, fatal, a malformed response, or an exhausted budget.
 *
 * <p>
 * <strong>Common node error codes:</strong>
 * <ul>
 * <li><strong>invalid_transaction</strong>: the node rejected a broadcast (bad nonce, insufficient funds, bad signature)</li>
 * <li><strong>bad_request</strong>: malformed path or query parameters</li>
 * <li><strong>internal_issue</strong>: the gateway could not reach an observer</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ApiException extends DharitriException {

    private final ApiError error;

    public ApiException(final ApiError error) {
        this(error, null);
    }

    public ApiException(final ApiError error, final @Nullable Throwable cause) {
        super(describe(Objects.requireNonNull(error, "error")), cause);
        this.error = error;
    }

    public static ApiException fatal(final String message) {
        return new ApiException(ApiError.of(ApiErrorKind.FATAL, message));
    }

    public ApiError error() {
        return error;
    }

    public ApiErrorKind kind() {
        return error.kind();
    }

    public @Nullable String code() {
        return error.code();
    }

    public int httpStatus() {
        return error.httpStatus();
    }

    private static String describe(final ApiError error) {
        final StringBuilder sb = new StringBuilder("[").append(error.kind()).append("] ").append(error.message());
        if (error.code() != null) {
            sb.append(" (code=").append(error.code()).append(')');
        }
        if (error.httpStatus() != 0) {
            sb.append(" (http=").append(error.httpStatus()).append(')');
        }
        return sb.toString();
    }
}
