// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.error;

/**
 * Classification of a failed gateway interaction.
 *
 * <p>The kind decides what a caller may do next:
 * <ul>
 *   <li>{@link #TRANSIENT}, {@link #TIMEOUT} - safe to retry after a delay</li>
 *   <li>{@link #RATE_LIMITED} - safe to retry, with a longer delay than transient errors</li>
 *   <li>{@link #FATAL}, {@link #DECODE} - retrying returns the same answer</li>
 *   <li>{@link #TIMED_OUT}, {@link #CANCELLED} - the caller's own budget ran out or was withdrawn</li>
 * </ul>
 *
 * @since 0.1.0
 */
public enum ApiErrorKind {

    /** HTTP 5xx or a connection-level transport failure. */
    TRANSIENT(true),

    /** HTTP 429 or a node payload signalling throttling. */
    RATE_LIMITED(true),

    /** Bad request or a node-reported error with an explicit code. */
    FATAL(false),

    /** A single request exceeded its transport timeout. */
    TIMEOUT(true),

    /** The response body did not match the expected envelope or payload shape. */
    DECODE(false),

    /** Retry or poll budget exhausted (attempts or deadline). */
    TIMED_OUT(false),

    /** The calling thread was interrupted. */
    CANCELLED(false);

    private final boolean retryable;

    ApiErrorKind(final boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Returns whether another attempt of the same request may succeed.
     *
     * @return {@code true} for transient, rate-limited and timeout failures
     */
    public boolean isRetryable() {
        return retryable;
    }
}
