// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import io.dharitri.sdk.core.error.ApiException;
import io.dharitri.sdk.core.model.AccountInfo;
import io.dharitri.sdk.core.model.HyperBlock;
import io.dharitri.sdk.core.model.NetworkConfig;
import io.dharitri.sdk.core.model.NetworkEconomics;
import io.dharitri.sdk.core.model.NetworkStatus;
import io.dharitri.sdk.core.model.TokenMetadata;
import io.dharitri.sdk.core.model.TransactionOnNetwork;
import io.dharitri.sdk.core.model.TransactionRequest;
import io.dharitri.sdk.core.model.TransactionStatus;
import io.dharitri.sdk.core.model.TransactionStatusPolicy;
import io.dharitri.sdk.core.types.Address;
import io.dharitri.sdk.core.types.TxHash;

/**
 * Typed client for a Dharitri gateway.
 *
 * <p>
 * Every read resolves its endpoint through the {@link EndpointCatalog}, runs
 * over the configured {@link HttpTransport}, and retries in place on
 * transient, rate-limited and timed-out failures according to
 * {@link GatewayConfig#retryPolicy()}. {@link #sendTransaction} is never
 * retried. All failures surface as {@link ApiException}.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * try (GatewayProxy proxy = GatewayProxy.builder()
 *         .url(Gateways.DEVNET_GATEWAY)
 *         .buildProxy()) {
 *     NetworkConfig config = proxy.getNetworkConfig();
 *     AccountInfo account = proxy.getAccount("drt1...");
 * }
 * }</pre>
 *
 * <p>
 * Implementations are thread-safe.
 *
 * @since 0.1.0
 */
public interface GatewayProxy extends AutoCloseable {

    NetworkConfig getNetworkConfig();

    NetworkEconomics getNetworkEconomics();

    /**
     * Returns the status of one shard, or of the metachain for
     * {@link NetworkStatus#METACHAIN_SHARD}.
     */
    NetworkStatus getNetworkStatus(long shard);

    AccountInfo getAccount(String address);

    default AccountInfo getAccount(final Address address) {
        Objects.requireNonNull(address, "address");
        return getAccount(address.value());
    }

    /**
     * Broadcasts a signed transaction.
     *
     * <p>
     * A failure is reported once, with the node's kind, message and code, and is
     * never retried: the caller decides whether resubmitting with the same nonce
     * is safe.
     *
     * @param request the signed transaction
     * @return the hash the node assigned
     * @throws ApiException if the node rejects the transaction or cannot be reached
     */
    TxHash sendTransaction(TransactionRequest request);

    TransactionOnNetwork getTransaction(TxHash hash, boolean withResults);

    default TransactionOnNetwork getTransaction(final TxHash hash) {
        return getTransaction(hash, true);
    }

    TransactionStatus getTransactionStatus(TxHash hash);

    TokenMetadata getToken(String identifier);

    HyperBlock getHyperBlockByNonce(long nonce);

    HyperBlock getHyperBlockByHash(String hash);

    /**
     * Polls the transaction until it succeeds, fails, or the poll policy runs out.
     *
     * @param hash the transaction to wait for
     * @return the terminal outcome
     */
    PollResult awaitCompletion(TxHash hash);

    /**
     * Like {@link #awaitCompletion(TxHash)} but also stops at {@code deadline}.
     */
    PollResult awaitCompletion(TxHash hash, Instant deadline);

    GatewayConfig config();

    /** Releases the transport if the proxy created it. */
    @Override
    void close();

    static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for proxies and simulator clients.
     *
     * <p>
     * Either start from a complete {@link GatewayConfig} via {@link #config} or
     * set individual values; individual setters override the corresponding
     * component of a supplied config.
     */
    final class Builder {

        private @Nullable GatewayConfig config;
        private @Nullable String url;
        private @Nullable ApiVersion apiVersion;
        private @Nullable Duration timeout;
        private @Nullable Duration connectTimeout;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private @Nullable RetryPolicy retryPolicy;
        private @Nullable RetryPolicy pollPolicy;
        private @Nullable Boolean simulator;
        private @Nullable TransactionStatusPolicy statusPolicy;
        private @Nullable HttpTransport transport;
        private BackoffClock clock = BackoffClock.SYSTEM;

        Builder() {
        }

        public Builder config(final GatewayConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder url(final String url) {
            this.url = url;
            return this;
        }

        public Builder apiVersion(final ApiVersion apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder timeout(final Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder header(final String name, final String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder retryPolicy(final RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Shorthand for the number of in-place retries on top of the first attempt.
         *
         * @param retries retries after the first attempt (0 disables retrying)
         * @return this builder
         */
        public Builder retries(final int retries) {
            if (retries < 0) {
                throw new IllegalArgumentException("retries must be >= 0, got: " + retries);
            }
            final RetryPolicy base = retryPolicy != null ? retryPolicy : RetryPolicy.defaults();
            this.retryPolicy = base.toBuilder().maxAttempts(retries + 1).build();
            return this;
        }

        public Builder pollPolicy(final RetryPolicy pollPolicy) {
            this.pollPolicy = pollPolicy;
            return this;
        }

        public Builder statusPolicy(final TransactionStatusPolicy statusPolicy) {
            this.statusPolicy = statusPolicy;
            return this;
        }

        /** Marks the target as a chain simulator, enabling {@link #buildSimulator()}. */
        public Builder simulator(final boolean simulator) {
            this.simulator = simulator;
            return this;
        }

        /**
         * Uses a caller-owned transport instead of the default {@link JdkHttpTransport}.
         * The proxy does not close it.
         */
        public Builder transport(final HttpTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        Builder clock(final BackoffClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Builds a {@link ChainSimulator} when the simulator flag is set, otherwise a production proxy.
         */
        public GatewayProxy build() {
            final GatewayConfig resolved = resolveConfig();
            return resolved.simulator() ? newSimulator(resolved) : newProxy(resolved);
        }

        /** Builds a production proxy whose catalog refuses simulator operations. */
        public GatewayProxy buildProxy() {
            return newProxy(resolveConfig());
        }

        /**
         * Builds a simulator client.
         *
         * @throws IllegalStateException unless {@code simulator(true)} was set,
         *                               here or in the supplied config
         */
        public ChainSimulator buildSimulator() {
            final GatewayConfig resolved = resolveConfig();
            if (!resolved.simulator()) {
                throw new IllegalStateException(
                        "Cannot build a ChainSimulator for a production gateway. Call simulator(true) first.");
            }
            return newSimulator(resolved);
        }

        private GatewayProxy newProxy(final GatewayConfig resolved) {
            final boolean owned = transport == null;
            return new DefaultGatewayProxy(resolved, resolveTransport(resolved), owned,
                    EndpointCatalog.forVersion(resolved.apiVersion()), clock);
        }

        private ChainSimulator newSimulator(final GatewayConfig resolved) {
            final boolean owned = transport == null;
            return new DefaultChainSimulator(resolved, resolveTransport(resolved), owned, clock);
        }

        private HttpTransport resolveTransport(final GatewayConfig resolved) {
            if (transport != null) {
                return transport;
            }
            return JdkHttpTransport.builder()
                    .connectTimeout(resolved.connectTimeout())
                    .headers(resolved.headers())
                    .build();
        }

        private GatewayConfig resolveConfig() {
            final GatewayConfig base = config;
            final String resolvedUrl = url != null ? url : base != null ? base.baseUrl() : null;
            if (resolvedUrl == null) {
                throw new IllegalStateException("No gateway URL configured. Call url() or config() before build().");
            }
            final Map<String, String> mergedHeaders = new LinkedHashMap<>();
            if (base != null) {
                mergedHeaders.putAll(base.headers());
            }
            mergedHeaders.putAll(headers);
            return new GatewayConfig(
                    resolvedUrl,
                    apiVersion != null ? apiVersion : base != null ? base.apiVersion() : null,
                    timeout != null ? timeout : base != null ? base.requestTimeout() : null,
                    connectTimeout != null ? connectTimeout : base != null ? base.connectTimeout() : null,
                    mergedHeaders,
                    retryPolicy != null ? retryPolicy : base != null ? base.retryPolicy() : null,
                    pollPolicy != null ? pollPolicy : base != null ? base.pollPolicy() : null,
                    simulator != null ? simulator : base != null && base.simulator(),
                    statusPolicy != null ? statusPolicy : base != null ? base.statusPolicy() : null);
        }
    }
}
