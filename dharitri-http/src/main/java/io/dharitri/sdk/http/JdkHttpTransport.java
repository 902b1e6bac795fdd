// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import io.dharitri.sdk.core.DebugLogger;
import io.dharitri.sdk.core.LogFormatter;

/**
 * {@link HttpTransport} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * The client and its connection pool are created once per transport. The
 * transport owns a daemon thread pool for the client's asynchronous plumbing
 * and shuts it down on {@link #close()}.
 */
public final class JdkHttpTransport implements HttpTransport {

    private static final AtomicInteger THREAD_ID = new AtomicInteger();

    private final HttpClient httpClient;
    private final ExecutorService executor;
    private final Map<String, String> headers;

    private JdkHttpTransport(final Duration connectTimeout, final Map<String, String> headers) {
        this.executor = Executors.newCachedThreadPool(runnable -> {
            final Thread thread = new Thread(runnable, "dharitri-http-" + THREAD_ID.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.httpClient = HttpClient.newBuilder()
                .executor(executor)
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.headers = Map.copyOf(headers);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public RawResponse execute(final TransportRequest request) throws TransportException {
        final HttpRequest httpRequest = buildRequest(request);
        final long start = System.nanoTime();
        final HttpResponse<String> response = send(httpRequest, request);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        DebugLogger.logRequest(LogFormatter.formatRequest(
                request.method().name(), request.uri().getPath(), durationMicros)
                + " status=" + response.statusCode());
        return new RawResponse(response.statusCode(), response.body());
    }

    private HttpRequest buildRequest(final TransportRequest request) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .header("Accept", "application/json")
                .timeout(request.timeout());

        if (request.method() == HttpMethod.POST) {
            final byte[] body = request.body();
            builder.header("Content-Type", "application/json");
            builder.POST(body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofByteArray(body));
        } else {
            builder.GET();
        }

        for (Map.Entry<String, String> entry : headers.entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<String, String> entry : request.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    private HttpResponse<String> send(final HttpRequest httpRequest, final TransportRequest request)
            throws TransportException {
        try {
            return httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw failure(reasonFor(e), request, e);
        } catch (UnresolvedAddressException e) {
            throw failure(TransportException.Reason.CONNECT, request, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(TransportException.Reason.INTERRUPTED, request, e);
        }
    }

    /**
     * Maps a client I/O failure to its reason. Connect timeouts are timeouts:
     * the budget ran out, the peer did not refuse.
     */
    static TransportException.Reason reasonFor(final IOException failure) {
        if (failure instanceof HttpTimeoutException) {
            return TransportException.Reason.TIMEOUT;
        }
        if (failure instanceof ConnectException) {
            return TransportException.Reason.CONNECT;
        }
        return TransportException.Reason.IO;
    }

    private static TransportException failure(
            final TransportException.Reason reason, final TransportRequest request, final Throwable cause) {
        final String detail = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new TransportException(
                reason,
                reason + " failure during " + request.method() + " " + request.uri() + ": " + detail,
                cause);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public Builder headers(final Map<String, String> headers) {
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public JdkHttpTransport build() {
            if (connectTimeout.isZero() || connectTimeout.isNegative()) {
                throw new IllegalArgumentException("connectTimeout must be > 0, got: " + connectTimeout);
            }
            return new JdkHttpTransport(connectTimeout, headers);
        }
    }
}
