// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.error;

/**
 * Thrown when a gateway payload is missing a required field or carries a
 * field of the wrong type.
 *
 * <p>Decoders never substitute defaults for required fields; the proxy
 * reports this as an {@link ApiErrorKind#DECODE} failure.
 */
public final class DecodeException extends DharitriException {

    public DecodeException(final String message) {
        super(message);
    }

    public DecodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
