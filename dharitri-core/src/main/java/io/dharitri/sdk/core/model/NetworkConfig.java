// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Network parameters reported by {@code GET /network/config}.
 *
 * <p>
 * Callers fetch this once and reuse it to fill and validate outgoing
 * transactions (chain id, minimum gas price and limit, transaction version).
 * The SDK never mutates a cached instance.
 *
 * @param chainId               the chain identifier (e.g. {@code "D"} for devnet)
 * @param minGasPrice           minimum accepted gas price
 * @param minGasLimit           minimum accepted gas limit
 * @param gasPerDataByte        gas charged per byte of transaction data
 * @param minTransactionVersion lowest transaction version accepted
 * @param roundDurationMillis   duration of one round in milliseconds
 * @param numShards             number of shards, metachain excluded
 * @param startTime             genesis timestamp in seconds
 * @param currentEpoch          epoch reported alongside the config, if present
 * @param currentRound          round reported alongside the config, if present
 * @since 0.1.0
 */
public record NetworkConfig(
        String chainId,
        long minGasPrice,
        long minGasLimit,
        long gasPerDataByte,
        int minTransactionVersion,
        long roundDurationMillis,
        int numShards,
        long startTime,
        @Nullable Long currentEpoch,
        @Nullable Long currentRound) {

    public NetworkConfig {
        Objects.requireNonNull(chainId, "chainId cannot be null");
        if (chainId.isBlank()) {
            throw new IllegalArgumentException("chainId cannot be blank");
        }
    }

    /**
     * Minimum gas limit for a transaction carrying {@code dataLength} bytes of data.
     *
     * @param dataLength number of data bytes
     * @return {@code minGasLimit + gasPerDataByte * dataLength}
     */
    public long minGasLimitFor(final int dataLength) {
        if (dataLength < 0) {
            throw new IllegalArgumentException("dataLength must be >= 0, got: " + dataLength);
        }
        return minGasLimit + gasPerDataByte * dataLength;
    }
}
