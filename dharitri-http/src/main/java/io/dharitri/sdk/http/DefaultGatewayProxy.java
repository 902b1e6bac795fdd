// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import io.dharitri.sdk.core.DebugLogger;
import io.dharitri.sdk.core.LogFormatter;
import io.dharitri.sdk.core.error.ApiError;
import io.dharitri.sdk.core.error.ApiException;
import io.dharitri.sdk.core.error.DecodeException;
import io.dharitri.sdk.core.model.AccountInfo;
import io.dharitri.sdk.core.model.HyperBlock;
import io.dharitri.sdk.core.model.NetworkConfig;
import io.dharitri.sdk.core.model.NetworkEconomics;
import io.dharitri.sdk.core.model.NetworkStatus;
import io.dharitri.sdk.core.model.TokenMetadata;
import io.dharitri.sdk.core.model.TransactionOnNetwork;
import io.dharitri.sdk.core.model.TransactionRequest;
import io.dharitri.sdk.core.model.TransactionStatus;
import io.dharitri.sdk.core.types.TxHash;
import io.dharitri.sdk.http.internal.GatewayDecoders;
import io.dharitri.sdk.http.internal.GatewayEnvelope;

/**
 * Default implementation of {@link GatewayProxy}.
 *
 * <p>
 * Reads go through {@link RetryRunner}; the broadcast runs exactly once.
 * Polling uses single-attempt fetches so that the poll schedule alone governs
 * the pacing.
 */
final class DefaultGatewayProxy implements GatewayProxy {

    private static final Logger log = LoggerFactory.getLogger(DefaultGatewayProxy.class);

    private final GatewayConfig config;
    private final HttpTransport transport;
    private final boolean ownsTransport;
    private final EndpointCatalog catalog;
    private final ErrorClassifier classifier = new ErrorClassifier();
    private final BackoffClock clock;

    DefaultGatewayProxy(
            final GatewayConfig config,
            final HttpTransport transport,
            final boolean ownsTransport,
            final EndpointCatalog catalog,
            final BackoffClock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.ownsTransport = ownsTransport;
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public NetworkConfig getNetworkConfig() {
        return call(Operation.GET_NETWORK_CONFIG, Map.of(), GatewayDecoders::networkConfig);
    }

    @Override
    public NetworkEconomics getNetworkEconomics() {
        return call(Operation.GET_NETWORK_ECONOMICS, Map.of(), GatewayDecoders::networkEconomics);
    }

    @Override
    public NetworkStatus getNetworkStatus(final long shard) {
        if (shard < 0) {
            throw ApiException.fatal("shard must be >= 0, got: " + shard);
        }
        return call(Operation.GET_NETWORK_STATUS, Map.of("shard", Long.toString(shard)),
                data -> GatewayDecoders.networkStatus(data, shard));
    }

    @Override
    public AccountInfo getAccount(final String address) {
        requireText(address, "address");
        return call(Operation.GET_ACCOUNT, Map.of("address", address),
                data -> GatewayDecoders.account(data, address));
    }

    @Override
    public TxHash sendTransaction(final TransactionRequest request) {
        Objects.requireNonNull(request, "request");
        final byte[] payload = request.payload();
        DebugLogger.logTx(LogFormatter.formatTxSend(
                request.sender(), request.nonce().map(String::valueOf).orElse("auto"), payload.length));

        final long start = clock.nanoTime();
        final Endpoint endpoint = catalog.resolve(Operation.SEND_TRANSACTION, Map.of());
        final TxHash hash;
        try {
            hash = executeOnce(endpoint, payload, GatewayDecoders::txHash);
        } catch (ApiException e) {
            log.warn("Broadcast from {} with nonce {} rejected: {}",
                    request.sender(), request.nonce().orElse(null), e.getMessage());
            throw e;
        }
        DebugLogger.logTx(LogFormatter.formatTxHash(hash.value(), (clock.nanoTime() - start) / 1_000L));
        return hash;
    }

    @Override
    public TransactionOnNetwork getTransaction(final TxHash hash, final boolean withResults) {
        Objects.requireNonNull(hash, "hash");
        return call(Operation.GET_TRANSACTION, transactionParams(hash, withResults),
                data -> GatewayDecoders.transaction(data, hash, config.statusPolicy()));
    }

    @Override
    public TransactionStatus getTransactionStatus(final TxHash hash) {
        Objects.requireNonNull(hash, "hash");
        return call(Operation.GET_TRANSACTION_STATUS, Map.of("hash", hash.value()),
                data -> GatewayDecoders.transactionStatus(data, config.statusPolicy()));
    }

    @Override
    public TokenMetadata getToken(final String identifier) {
        requireText(identifier, "identifier");
        return call(Operation.GET_TOKEN, Map.of("identifier", identifier),
                data -> GatewayDecoders.token(data, identifier));
    }

    @Override
    public HyperBlock getHyperBlockByNonce(final long nonce) {
        if (nonce < 0) {
            throw ApiException.fatal("nonce must be >= 0, got: " + nonce);
        }
        return call(Operation.GET_HYPER_BLOCK_BY_NONCE, Map.of("nonce", Long.toString(nonce)),
                GatewayDecoders::hyperBlock);
    }

    @Override
    public HyperBlock getHyperBlockByHash(final String hash) {
        requireText(hash, "hash");
        return call(Operation.GET_HYPER_BLOCK_BY_HASH, Map.of("hash", hash), GatewayDecoders::hyperBlock);
    }

    @Override
    public PollResult awaitCompletion(final TxHash hash) {
        return poller().await(hash, null);
    }

    @Override
    public PollResult awaitCompletion(final TxHash hash, final Instant deadline) {
        Objects.requireNonNull(deadline, "deadline");
        return poller().await(hash, deadline);
    }

    @Override
    public GatewayConfig config() {
        return config;
    }

    @Override
    public void close() {
        if (ownsTransport) {
            try {
                transport.close();
            } catch (Exception e) {
                log.warn("Failed to close transport", e);
            }
        }
    }

    /** Poller pacing its ticks with the configured poll policy and real sleeps. */
    private TransactionPoller poller() {
        return new TransactionPoller(this::fetchTransactionOnce, config.pollPolicy(), clock, clock::sleep);
    }

    /** One fetch, no in-place retry. */
    TransactionOnNetwork fetchTransactionOnce(final TxHash hash) {
        final Endpoint endpoint = catalog.resolve(Operation.GET_TRANSACTION, transactionParams(hash, true));
        return executeOnce(endpoint, null, data -> GatewayDecoders.transaction(data, hash, config.statusPolicy()));
    }

    BackoffClock clock() {
        return clock;
    }

    EndpointCatalog catalog() {
        return catalog;
    }

    /**
     * Resolves and runs an operation, retrying in place when it is idempotent.
     */
    private <T> T call(
            final Operation operation, final Map<String, String> params, final Function<JsonNode, T> decoder) {
        final Endpoint endpoint = catalog.resolve(operation, params);
        if (!operation.isIdempotent()) {
            return executeOnce(endpoint, null, decoder);
        }
        return RetryRunner.run(endpoint.toString(), () -> executeOnce(endpoint, null, decoder),
                config.retryPolicy(), clock);
    }

    /**
     * Runs a single exchange and decodes the envelope payload.
     *
     * @throws ApiException for every failure, classified
     */
    <T> T executeOnce(
            final Endpoint endpoint, final byte @Nullable [] body, final Function<JsonNode, T> decoder) {
        final TransportRequest request = endpoint.method() == HttpMethod.GET
                ? TransportRequest.get(config.resolve(endpoint), config.requestTimeout())
                : TransportRequest.post(config.resolve(endpoint), body, config.requestTimeout());

        final long start = clock.nanoTime();
        final RawResponse response;
        try {
            response = transport.execute(request);
        } catch (TransportException e) {
            final ApiError error = classifier.classify(e);
            DebugLogger.logRequest(LogFormatter.formatRequestError(
                    endpoint.method().name(), endpoint.path(), error.kind(), error.message(),
                    (clock.nanoTime() - start) / 1_000L));
            throw new ApiException(error, e);
        }

        final long micros = (clock.nanoTime() - start) / 1_000L;
        if (!response.isSuccess()) {
            throw requestFailed(endpoint, classifier.classify(response), null, micros);
        }
        final GatewayEnvelope envelope;
        try {
            envelope = GatewayEnvelope.parse(response.body());
        } catch (DecodeException e) {
            throw requestFailed(endpoint, classifier.classify(e, response.statusCode()), e, micros);
        }
        if (envelope.hasError()) {
            throw requestFailed(endpoint, classifier.classify(response), null, micros);
        }
        try {
            return decoder.apply(envelope.data());
        } catch (DecodeException e) {
            throw requestFailed(endpoint, classifier.classify(e, response.statusCode()), e, micros);
        }
    }

    private static ApiException requestFailed(
            final Endpoint endpoint, final ApiError error, final @Nullable Throwable cause, final long micros) {
        DebugLogger.logRequest(LogFormatter.formatRequestError(
                endpoint.method().name(), endpoint.path(), error.kind(), error.message(), micros));
        return new ApiException(error, cause);
    }

    private static Map<String, String> transactionParams(final TxHash hash, final boolean withResults) {
        return Map.of("hash", hash.value(), "withResults", Boolean.toString(withResults));
    }

    private static void requireText(final String value, final String name) {
        if (value == null || value.isBlank()) {
            throw ApiException.fatal(name + " cannot be blank");
        }
    }
}
