// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import io.dharitri.sdk.core.error.ApiError;
import io.dharitri.sdk.core.model.TransactionOnNetwork;
import io.dharitri.sdk.core.types.TxHash;

/**
 * Outcome of waiting for a transaction to reach finality.
 *
 * @param hash        the transaction polled
 * @param state       the terminal state
 * @param transaction the last transaction observed, if any fetch succeeded
 * @param error       the failure that ended or last disturbed polling, if any
 * @param attempts    number of status fetches made
 * @param elapsed     wall time spent polling
 * @since 0.1.0
 */
public record PollResult(
        TxHash hash,
        State state,
        @Nullable TransactionOnNetwork transaction,
        @Nullable ApiError error,
        int attempts,
        Duration elapsed) {

    /**
     * Poller lifecycle. Every state except {@link #POLLING} is terminal.
     */
    public enum State {
        POLLING,
        /** The node reported a successful execution. */
        SUCCEEDED,
        /** The node reported a failed or invalid transaction. */
        FAILED,
        /** Attempts or deadline exhausted while the transaction was still pending. */
        TIMED_OUT,
        /** A non-retryable failure (fatal response or undecodable payload). */
        ERRORED,
        /** The polling thread was interrupted. */
        CANCELLED;

        public boolean isTerminal() {
            return this != POLLING;
        }
    }

    public PollResult {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(elapsed, "elapsed");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("PollResult must carry a terminal state");
        }
    }

    public boolean isSuccessful() {
        return state == State.SUCCEEDED;
    }

    public Optional<TransactionOnNetwork> transactionIfPresent() {
        return Optional.ofNullable(transaction);
    }
}
