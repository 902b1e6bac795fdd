// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.util.Locale;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.dharitri.sdk.core.LogSanitizer;
import io.dharitri.sdk.core.error.ApiError;
import io.dharitri.sdk.core.error.ApiErrorKind;
import io.dharitri.sdk.core.error.DecodeException;
import io.dharitri.sdk.http.internal.GatewayEnvelope;

/**
 * Turns failed exchanges into {@link ApiError}s.
 *
 * <p>
 * <strong>Classification rules:</strong>
 * <ul>
 * <li>429, or a node message/code mentioning rate limiting or too many requests: {@code RATE_LIMITED}</li>
 * <li>5xx: {@code TRANSIENT}</li>
 * <li>other 4xx, or a node error envelope on any status: {@code FATAL}</li>
 * <li>a 2xx body that is not a well-formed envelope: {@code DECODE}</li>
 * <li>transport {@code CONNECT}/{@code IO}: {@code TRANSIENT}; {@code TIMEOUT}: {@code TIMEOUT};
 * {@code INTERRUPTED}: {@code CANCELLED}</li>
 * </ul>
 *
 * <p>
 * Stateless and thread-safe.
 *
 * @since 0.1.0
 */
public final class ErrorClassifier {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    /**
     * Classifies a response that is either non-2xx or carries a node error envelope.
     *
     * @param response the response
     * @return the classified error
     * @throws IllegalArgumentException if the response is a clean success
     */
    public ApiError classify(final RawResponse response) {
        Objects.requireNonNull(response, "response");
        final int status = response.statusCode();

        GatewayEnvelope envelope = null;
        String decodeFailure = null;
        try {
            envelope = GatewayEnvelope.parse(response.body());
        } catch (DecodeException e) {
            decodeFailure = e.getMessage();
        }

        final String nodeMessage = envelope != null && !envelope.error().isBlank() ? envelope.error() : null;
        final String nodeCode = envelope != null && envelope.hasError() ? envelope.code() : null;
        final String message = nodeMessage != null ? nodeMessage : fallbackMessage(status, response.body());
        final boolean fromNode = nodeMessage != null || nodeCode != null;

        if (status == 429 || isThrottled(nodeMessage, nodeCode)) {
            return new ApiError(ApiErrorKind.RATE_LIMITED, message, nodeCode, status, fromNode);
        }
        if (status >= 500) {
            return new ApiError(ApiErrorKind.TRANSIENT, message, nodeCode, status, fromNode);
        }
        if (status >= 400) {
            return new ApiError(ApiErrorKind.FATAL, message, nodeCode, status, fromNode);
        }
        if (envelope == null) {
            return new ApiError(ApiErrorKind.DECODE, decodeFailure, null, status);
        }
        if (envelope.hasError()) {
            return new ApiError(ApiErrorKind.FATAL, message, nodeCode, status, fromNode);
        }
        if (response.isSuccess()) {
            throw new IllegalArgumentException("Response is not a failure: HTTP " + status);
        }
        return new ApiError(ApiErrorKind.FATAL, "Unexpected HTTP status " + status, null, status);
    }

    /**
     * Classifies a failure that produced no HTTP response.
     *
     * @param failure the transport failure
     * @return the classified error, with {@code httpStatus == 0}
     */
    public ApiError classify(final TransportException failure) {
        Objects.requireNonNull(failure, "failure");
        final ApiErrorKind kind;
        switch (failure.reason()) {
            case TIMEOUT:
                kind = ApiErrorKind.TIMEOUT;
                break;
            case INTERRUPTED:
                kind = ApiErrorKind.CANCELLED;
                break;
            case CONNECT:
            case IO:
            default:
                kind = ApiErrorKind.TRANSIENT;
                break;
        }
        final String message = failure.getMessage() == null ? failure.reason().name() : failure.getMessage();
        return new ApiError(kind, message, null, 0);
    }

    /**
     * Classifies a success response whose payload did not match the expected shape.
     */
    public ApiError classify(final DecodeException failure, final int httpStatus) {
        Objects.requireNonNull(failure, "failure");
        return new ApiError(ApiErrorKind.DECODE, failure.getMessage(), null, httpStatus);
    }

    static boolean isThrottled(final @Nullable String message, final @Nullable String code) {
        return mentionsThrottling(message) || mentionsThrottling(code);
    }

    private static boolean mentionsThrottling(final @Nullable String text) {
        if (text == null) {
            return false;
        }
        final String lower = text.toLowerCase(Locale.ROOT).replace('_', ' ');
        return lower.contains("rate limit")
                || lower.contains("too many requests")
                || lower.contains("throttl");
    }

    private static String fallbackMessage(final int status, final String body) {
        if (body.isBlank()) {
            return "HTTP " + status;
        }
        final String trimmed = body.strip();
        final String snippet = trimmed.length() > MAX_BODY_IN_MESSAGE
                ? trimmed.substring(0, MAX_BODY_IN_MESSAGE) + "..."
                : trimmed;
        return "HTTP " + status + ": " + LogSanitizer.sanitize(snippet);
    }
}
