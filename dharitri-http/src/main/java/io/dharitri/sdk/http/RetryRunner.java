// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.dharitri.sdk.core.DebugLogger;
import io.dharitri.sdk.core.LogFormatter;
import io.dharitri.sdk.core.error.ApiError;
import io.dharitri.sdk.core.error.ApiErrorKind;
import io.dharitri.sdk.core.error.ApiException;

/**
 * Retries an idempotent gateway call in place while the {@link RetryPolicy} yields a delay.
 *
 * <p>
 * Non-retryable failures ({@code FATAL}, {@code DECODE}, {@code CANCELLED})
 * are rethrown unchanged on first occurrence. When the policy is exhausted the
 * caller gets a {@code TIMED_OUT} {@link ApiException} whose cause is the last
 * failure and whose suppressed exceptions are the earlier ones, in order. An
 * interrupt during backoff stops the loop with {@code CANCELLED} and leaves
 * the thread's interrupt flag set.
 */
final class RetryRunner {

    private static final Logger log = LoggerFactory.getLogger(RetryRunner.class);

    private RetryRunner() {
    }

    static <T> T run(
            final String operation,
            final Supplier<T> call,
            final RetryPolicy policy,
            final BackoffClock clock) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(clock, "clock");

        // Lazy-initialized on first failure to avoid allocation on success path
        List<ApiException> failures = null;
        final long start = clock.nanoTime();

        for (int attempt = 0; ; attempt++) {
            final ApiException failure;
            try {
                return call.get();
            } catch (ApiException e) {
                if (!e.kind().isRetryable()) {
                    throw e;
                }
                failure = e;
            }
            if (failures == null) {
                failures = new ArrayList<>();
            }
            failures.add(failure);

            final Duration elapsed = Duration.ofNanos(clock.nanoTime() - start);
            final Optional<Duration> delay = policy.nextDelay(attempt, failure.kind(), elapsed);
            if (delay.isEmpty()) {
                throw exhausted(operation, failures, elapsed);
            }

            log.warn("{} attempt {} failed ({}), retrying in {}ms",
                    operation, attempt + 1, failure.kind(), delay.get().toMillis());
            DebugLogger.logRetry(LogFormatter.formatRetry(operation, attempt + 1, failure.kind(), delay.get().toMillis()));
            try {
                clock.sleep(delay.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw cancelled(operation, failure, e);
            }
        }
    }

    static ApiException cancelled(final String operation, final ApiException last, final InterruptedException cause) {
        final ApiException cancelled = new ApiException(
                new ApiError(ApiErrorKind.CANCELLED, operation + " interrupted during backoff", null, 0), cause);
        cancelled.addSuppressed(last);
        return cancelled;
    }

    private static ApiException exhausted(
            final String operation, final List<ApiException> failures, final Duration elapsed) {
        final ApiException last = failures.get(failures.size() - 1);
        final ApiException exhausted = new ApiException(new ApiError(
                ApiErrorKind.TIMED_OUT,
                operation + " failed after " + failures.size() + " attempt(s) in " + elapsed.toMillis()
                        + "ms, last error: " + last.error().message(),
                last.code(),
                last.httpStatus()), last);

        // Earlier failures travel as suppressed exceptions
        for (int i = 0; i < failures.size() - 1; i++) {
            exhausted.addSuppressed(failures.get(i));
        }
        return exhausted;
    }
}
