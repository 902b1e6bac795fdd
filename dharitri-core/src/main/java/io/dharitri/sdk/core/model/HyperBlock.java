// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A metachain block together with the transactions of the shard blocks it
 * notarizes.
 *
 * @param nonce           block nonce
 * @param round           round
 * @param epoch           epoch
 * @param hash            block hash
 * @param prevBlockHash   previous block hash
 * @param timestamp       block timestamp in seconds
 * @param numTxs          number of transactions
 * @param transactions    raw transactions, verbatim
 */
public record HyperBlock(
        long nonce,
        long round,
        long epoch,
        String hash,
        String prevBlockHash,
        long timestamp,
        int numTxs,
        List<JsonNode> transactions) {

    public HyperBlock {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(prevBlockHash, "prevBlockHash cannot be null");
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
