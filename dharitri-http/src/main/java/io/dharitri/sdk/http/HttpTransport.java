// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

/**
 * Single-attempt HTTP primitive underneath the gateway client.
 *
 * <p>
 * Implementations send exactly one request per call, never block past the
 * request's timeout, and report every wire-level failure as a
 * {@link TransportException}. They never retry; retry decisions belong to the
 * proxy and the transaction poller.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe. One
 * instance owns a connection pool and is meant to be shared by any number of
 * {@link GatewayProxy} instances.
 *
 * @see JdkHttpTransport
 */
public interface HttpTransport extends AutoCloseable {

    /**
     * Executes one HTTP request.
     *
     * @param request the request to send
     * @return the response, whatever its status code
     * @throws TransportException if no response was received
     */
    RawResponse execute(TransportRequest request) throws TransportException;

    /**
     * Releases pooled connections and threads. The default implementation does nothing.
     */
    @Override
    default void close() {
    }
}
