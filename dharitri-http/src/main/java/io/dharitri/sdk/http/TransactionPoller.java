// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.dharitri.sdk.core.DebugLogger;
import io.dharitri.sdk.core.LogFormatter;
import io.dharitri.sdk.core.error.ApiError;
import io.dharitri.sdk.core.error.ApiErrorKind;
import io.dharitri.sdk.core.error.ApiException;
import io.dharitri.sdk.core.model.TransactionOnNetwork;
import io.dharitri.sdk.core.model.TransactionStatus;
import io.dharitri.sdk.core.types.TxHash;

/**
 * Polls a transaction until the node reports a terminal status.
 *
 * <p>
 * Each tick makes exactly one fetch; the poller never retries in place.
 * Between ticks it hands the {@link RetryPolicy} delay to a {@link Tick},
 * which sleeps against a live gateway and produces a block against a
 * simulator.
 *
 * <p>
 * A "not found" answer is treated as pending: a freshly broadcast transaction
 * may not have propagated to the observer that serves the read yet.
 */
final class TransactionPoller {

    private static final Logger log = LoggerFactory.getLogger(TransactionPoller.class);

    /** Waits between two polls. */
    @FunctionalInterface
    interface Tick {
        void await(Duration delay) throws InterruptedException;
    }

    private final Function<TxHash, TransactionOnNetwork> fetcher;
    private final RetryPolicy policy;
    private final BackoffClock clock;
    private final Tick tick;

    TransactionPoller(
            final Function<TxHash, TransactionOnNetwork> fetcher,
            final RetryPolicy policy,
            final BackoffClock clock,
            final Tick tick) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tick = Objects.requireNonNull(tick, "tick");
    }

    /**
     * Polls until a terminal state.
     *
     * @param hash     the transaction
     * @param deadline absolute cut-off in addition to the policy's own budget, or {@code null}
     * @return the outcome; never throws for gateway failures
     */
    PollResult await(final TxHash hash, final @Nullable Instant deadline) {
        Objects.requireNonNull(hash, "hash");
        final long start = clock.nanoTime();
        TransactionOnNetwork last = null;
        ApiError lastError = null;

        for (int attempt = 0; ; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return finish(hash, PollResult.State.CANCELLED, last,
                        ApiError.of(ApiErrorKind.CANCELLED, "Polling interrupted"), attempt, start);
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                return finish(hash, PollResult.State.TIMED_OUT, last, lastError, attempt, start);
            }

            ApiErrorKind delayKind = ApiErrorKind.TRANSIENT;
            try {
                final TransactionOnNetwork tx = fetcher.apply(hash);
                last = tx;
                final TransactionStatus status = tx.status();
                DebugLogger.logTx(LogFormatter.formatTxPoll(hash.value(), attempt + 1, status.value()));
                switch (status.kind()) {
                    case SUCCESS:
                        return finish(hash, PollResult.State.SUCCEEDED, tx, null, attempt + 1, start);
                    case FAILED:
                    case INVALID:
                        return finish(hash, PollResult.State.FAILED, tx, null, attempt + 1, start);
                    case UNKNOWN:
                        log.debug("Unrecognized status '{}' for {}, still polling", status.value(), hash);
                        break;
                    default:
                        break;
                }
            } catch (ApiException e) {
                if (e.kind() == ApiErrorKind.CANCELLED) {
                    return finish(hash, PollResult.State.CANCELLED, last, e.error(), attempt + 1, start);
                }
                if (e.error().isNotFound()) {
                    log.debug("Transaction {} not visible yet", hash);
                } else if (!e.kind().isRetryable()) {
                    return finish(hash, PollResult.State.ERRORED, last, e.error(), attempt + 1, start);
                } else {
                    lastError = e.error();
                    delayKind = e.kind();
                    log.warn("Polling {} failed ({}), will retry", hash, e.kind());
                }
            }

            final Duration elapsed = Duration.ofNanos(clock.nanoTime() - start);
            final Optional<Duration> next = policy.nextDelay(attempt, delayKind, elapsed);
            if (next.isEmpty()) {
                return finish(hash, PollResult.State.TIMED_OUT, last, lastError, attempt + 1, start);
            }
            Duration delay = next.get();
            if (deadline != null) {
                final Duration remaining = Duration.between(clock.instant(), deadline);
                if (remaining.isNegative() || remaining.isZero()) {
                    return finish(hash, PollResult.State.TIMED_OUT, last, lastError, attempt + 1, start);
                }
                if (delay.compareTo(remaining) > 0) {
                    delay = remaining;
                }
            }

            try {
                tick.await(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return finish(hash, PollResult.State.CANCELLED, last,
                        ApiError.of(ApiErrorKind.CANCELLED, "Polling interrupted"), attempt + 1, start);
            } catch (ApiException e) {
                if (!e.kind().isRetryable()) {
                    return finish(hash, e.kind() == ApiErrorKind.CANCELLED
                            ? PollResult.State.CANCELLED
                            : PollResult.State.ERRORED, last, e.error(), attempt + 1, start);
                }
                lastError = e.error();
            }
        }
    }

    private PollResult finish(
            final TxHash hash,
            final PollResult.State state,
            final @Nullable TransactionOnNetwork transaction,
            final @Nullable ApiError error,
            final int attempts,
            final long start) {
        DebugLogger.logTx(LogFormatter.formatTxFinal(hash.value(), state.name(), attempts));
        return new PollResult(hash, state, transaction, error, attempts, Duration.ofNanos(clock.nanoTime() - start));
    }
}
