// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.util.Objects;

/**
 * Failure of a single HTTP exchange before a response was received.
 *
 * <p>
 * Connection refusals, DNS failures, resets and timeouts all surface as this
 * one type, tagged with a {@link Reason}; the underlying JDK exception is kept
 * as the cause. The exception is checked so that every call site of
 * {@link HttpTransport#execute(TransportRequest)} decides how to classify it.
 */
public final class TransportException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * What went wrong on the wire.
     */
    public enum Reason {
        /** Connection could not be established (refused, unresolved host, connect timeout). */
        CONNECT,
        /** No complete response within the request timeout. */
        TIMEOUT,
        /** The connection failed mid-exchange (reset, closed, protocol error). */
        IO,
        /** The calling thread was interrupted while waiting. */
        INTERRUPTED
    }

    private final Reason reason;

    public TransportException(final Reason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}
