// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.model;

import java.util.Objects;

/**
 * Status of a transaction as reported by the node, with its classification.
 *
 * <p>The raw string is node-defined and kept verbatim; the {@link Kind} comes
 * from a {@link TransactionStatusPolicy}, so new node statuses can be mapped
 * without changing this type.
 *
 * @param value the raw status string (e.g. {@code "success"}, {@code "pending"})
 * @param kind  the classification of {@code value}
 * @since 0.1.0
 */
public record TransactionStatus(String value, Kind kind) {

    /**
     * Classification of node status strings.
     */
    public enum Kind {
        /** Not yet executed; keep waiting. */
        PENDING,
        /** Executed successfully. Terminal. */
        SUCCESS,
        /** Executed and failed. Terminal. */
        FAILED,
        /** Rejected as invalid. Terminal. */
        INVALID,
        /** A status the policy does not know; treated as not terminal. */
        UNKNOWN
    }

    public TransactionStatus {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * Returns whether no further state change will occur.
     *
     * @return {@code true} for {@link Kind#SUCCESS}, {@link Kind#FAILED} and {@link Kind#INVALID}
     */
    public boolean isTerminal() {
        return kind == Kind.SUCCESS || kind == Kind.FAILED || kind == Kind.INVALID;
    }

    public boolean isSuccessful() {
        return kind == Kind.SUCCESS;
    }

    @Override
    public String toString() {
        return value + "(" + kind + ")";
    }
}
