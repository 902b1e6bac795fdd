// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import io.dharitri.sdk.core.types.TxHash;

/**
 * A transaction as seen by the network, decoded from {@code GET /transaction/{hash}}.
 *
 * <p>
 * Only query responses produce this type. Logs and smart contract results are
 * passed through as raw JSON; the SDK does not interpret contract semantics.
 *
 * <p>
 * Block coordinates are {@code null} until the transaction is included in a
 * block.
 *
 * @param hash                 the transaction hash
 * @param sender               sender address
 * @param receiver             receiver address
 * @param nonce                sender nonce
 * @param value                transferred value as a decimal string
 * @param status               status reported by the node
 * @param blockNonce           nonce of the including block, if known
 * @param round                round of inclusion, if known
 * @param blockHash            hash of the including block, if known
 * @param logs                 raw logs object, if any
 * @param smartContractResults raw smart contract results (empty when not requested)
 * @since 0.1.0
 */
public record TransactionOnNetwork(
        TxHash hash,
        String sender,
        String receiver,
        long nonce,
        String value,
        TransactionStatus status,
        @Nullable Long blockNonce,
        @Nullable Long round,
        @Nullable String blockHash,
        @Nullable JsonNode logs,
        List<JsonNode> smartContractResults) {

    public TransactionOnNetwork {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(sender, "sender cannot be null");
        Objects.requireNonNull(receiver, "receiver cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        smartContractResults = smartContractResults == null ? List.of() : List.copyOf(smartContractResults);
    }

    public boolean isIncluded() {
        return blockNonce != null;
    }
}
