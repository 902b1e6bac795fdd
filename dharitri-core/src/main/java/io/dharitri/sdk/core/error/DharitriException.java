// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.error;

/**
 * Base runtime exception for all Dharitri SDK failures.
 *
 * <p>
 * This sealed class forms the root of the SDK's exception hierarchy, so every
 * SDK error can be caught with a single catch clause while the concrete
 * subtypes stay closed.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * DharitriException
 * ├── {@link ApiException} - gateway call failures, carrying an {@link ApiError}
 * └── {@link DecodeException} - response payloads that do not match the expected shape
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     proxy.getAccount(address);
 * } catch (ApiException e) {
 *     if (e.kind().isRetryable()) {
 *         // back off and try again later
 *     }
 * } catch (DharitriException e) {
 *     // any other SDK error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class DharitriException extends RuntimeException
        permits ApiException,
        DecodeException {

    public DharitriException(final String message) {
        super(message);
    }

    public DharitriException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
