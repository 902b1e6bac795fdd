// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import io.dharitri.sdk.core.DebugLogger;
import io.dharitri.sdk.core.LogFormatter;
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
import io.dharitri.sdk.core.types.TxHash;

/**
 * Decorates a {@link DefaultGatewayProxy} that was built on a simulator-enabled catalog.
 *
 * <p>
 * Plain reads and the broadcast are delegated unchanged; only the block
 * control calls and the polling tick differ.
 */
final class DefaultChainSimulator implements ChainSimulator {

    private final DefaultGatewayProxy delegate;

    DefaultChainSimulator(
            final GatewayConfig config,
            final HttpTransport transport,
            final boolean ownsTransport,
            final BackoffClock clock) {
        if (!config.simulator()) {
            throw new IllegalStateException("Simulator client requires simulator=true in the configuration");
        }
        this.delegate = new DefaultGatewayProxy(
                config, transport, ownsTransport, new EndpointCatalog(config.apiVersion(), true), clock);
    }

    @Override
    public void generateBlocks(final int count) {
        if (count < 1) {
            throw ApiException.fatal("count must be >= 1, got: " + count);
        }
        DebugLogger.logSimulator(LogFormatter.formatSimulator("generate-blocks", count));
        control(Operation.SIMULATOR_GENERATE_BLOCKS, Map.of("count", Integer.toString(count)));
    }

    @Override
    public void generateBlocksUntilTransactionProcessed(final TxHash hash) {
        Objects.requireNonNull(hash, "hash");
        DebugLogger.logSimulator(LogFormatter.formatSimulator("generate-until-tx-processed", LogFormatter.shortenHash(hash.value())));
        control(Operation.SIMULATOR_GENERATE_BLOCKS_UNTIL_TX_PROCESSED, Map.of("hash", hash.value()));
    }

    @Override
    public void generateBlocksUntilEpochReached(final long epoch) {
        if (epoch < 0) {
            throw ApiException.fatal("epoch must be >= 0, got: " + epoch);
        }
        DebugLogger.logSimulator(LogFormatter.formatSimulator("generate-until-epoch", epoch));
        control(Operation.SIMULATOR_GENERATE_BLOCKS_UNTIL_EPOCH, Map.of("epoch", Long.toString(epoch)));
    }

    @Override
    public TxHash sendTransactionAndGenerate(final TransactionRequest request, final int blocks) {
        if (blocks < 1) {
            throw ApiException.fatal("blocks must be >= 1, got: " + blocks);
        }
        final TxHash hash = delegate.sendTransaction(request);
        generateBlocks(blocks);
        return hash;
    }

    @Override
    public PollResult awaitCompletion(final TxHash hash) {
        return simulatorPoller().await(hash, null);
    }

    @Override
    public PollResult awaitCompletion(final TxHash hash, final Instant deadline) {
        Objects.requireNonNull(deadline, "deadline");
        return simulatorPoller().await(hash, deadline);
    }

    // Each tick produces a block instead of sleeping.
    private TransactionPoller simulatorPoller() {
        return new TransactionPoller(delegate::fetchTransactionOnce, delegate.config().pollPolicy(),
                delegate.clock(), delay -> generateBlocks(1));
    }

    private void control(final Operation operation, final Map<String, String> params) {
        delegate.executeOnce(delegate.catalog().resolve(operation, params), null, data -> data);
    }

    @Override
    public NetworkConfig getNetworkConfig() {
        return delegate.getNetworkConfig();
    }

    @Override
    public NetworkEconomics getNetworkEconomics() {
        return delegate.getNetworkEconomics();
    }

    @Override
    public NetworkStatus getNetworkStatus(final long shard) {
        return delegate.getNetworkStatus(shard);
    }

    @Override
    public AccountInfo getAccount(final String address) {
        return delegate.getAccount(address);
    }

    @Override
    public TxHash sendTransaction(final TransactionRequest request) {
        return delegate.sendTransaction(request);
    }

    @Override
    public TransactionOnNetwork getTransaction(final TxHash hash, final boolean withResults) {
        return delegate.getTransaction(hash, withResults);
    }

    @Override
    public TransactionStatus getTransactionStatus(final TxHash hash) {
        return delegate.getTransactionStatus(hash);
    }

    @Override
    public TokenMetadata getToken(final String identifier) {
        return delegate.getToken(identifier);
    }

    @Override
    public HyperBlock getHyperBlockByNonce(final long nonce) {
        return delegate.getHyperBlockByNonce(nonce);
    }

    @Override
    public HyperBlock getHyperBlockByHash(final String hash) {
        return delegate.getHyperBlockByHash(hash);
    }

    @Override
    public GatewayConfig config() {
        return delegate.config();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
