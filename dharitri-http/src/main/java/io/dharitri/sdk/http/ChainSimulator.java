// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import io.dharitri.sdk.core.model.TransactionRequest;
import io.dharitri.sdk.core.types.TxHash;

/**
 * A {@link GatewayProxy} for a local chain simulator, where blocks are produced
 * only when the caller asks for them.
 *
 * <p>
 * Obtainable only from {@link GatewayProxy.Builder#buildSimulator()} with the
 * simulator flag set. {@link #awaitCompletion(TxHash)} generates one block
 * per poll instead of sleeping.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * try (ChainSimulator simulator = GatewayProxy.builder()
 *         .url(Gateways.LOCAL_SIMULATOR)
 *         .simulator(true)
 *         .buildSimulator()) {
 *     TxHash hash = simulator.sendTransactionAndGenerate(request, 1);
 *     TransactionOnNetwork tx = simulator.getTransaction(hash);
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public interface ChainSimulator extends GatewayProxy {

    /**
     * Produces {@code count} blocks.
     *
     * @param count number of blocks, at least 1
     */
    void generateBlocks(int count);

    void generateBlocksUntilTransactionProcessed(TxHash hash);

    void generateBlocksUntilEpochReached(long epoch);

    /**
     * Broadcasts a transaction, then produces {@code blocks} blocks so it is
     * included without waiting on wall-clock time.
     *
     * @param request the signed transaction
     * @param blocks  blocks to generate after the broadcast, at least 1
     * @return the transaction hash
     */
    TxHash sendTransactionAndGenerate(TransactionRequest request, int blocks);
}
