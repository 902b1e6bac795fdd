// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.model;

/**
 * Chain progress of one shard as reported by {@code GET /network/status/{shard}}.
 *
 * @param shard              shard id ({@code 4294967295} is the metachain)
 * @param currentRound       current round
 * @param epochNumber        current epoch
 * @param nonce              nonce of the latest block
 * @param highestFinalNonce  highest final block nonce
 * @param nonceAtEpochStart  nonce of the first block in the epoch
 * @param roundsPerEpoch     rounds in one epoch
 */
public record NetworkStatus(
        long shard,
        long currentRound,
        long epochNumber,
        long nonce,
        long highestFinalNonce,
        long nonceAtEpochStart,
        long roundsPerEpoch) {

    /** Shard id the gateway uses for the metachain. */
    public static final long METACHAIN_SHARD = 4294967295L;
}
