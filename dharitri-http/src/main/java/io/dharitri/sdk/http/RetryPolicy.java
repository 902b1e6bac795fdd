// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import org.jspecify.annotations.Nullable;

import io.dharitri.sdk.core.error.ApiErrorKind;

/**
 * Exponential backoff schedule shared by in-place retries and transaction polling.
 *
 * <p>
 * The delay after the failed attempt with zero-based index {@code i} is
 * {@code min(baseDelay × multiplier^i, maxDelay)}, perturbed by up to
 * {@code ±jitter} of itself, multiplied by {@link #rateLimitFactor()} for
 * {@code RATE_LIMITED} failures, and capped by whatever remains of the overall
 * deadline. No delay is offered once {@code maxAttempts} attempts have been
 * made or the deadline is spent.
 *
 * <p>
 * <strong>Default schedule</strong> ({@link #defaults()}): 3 attempts, 200ms
 * base, ×2, capped at 5s, no jitter, no deadline.
 * <br>
 * <strong>Polling schedule</strong> ({@link #pollingDefaults()}): 40 attempts,
 * 1s base, ×1.5, capped at 6s, 2 minute deadline.
 *
 * <p>
 * Instances are immutable. Without jitter the schedule is deterministic and
 * non-decreasing in the attempt index.
 *
 * @since 0.1.0
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(200);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);
    public static final double DEFAULT_RATE_LIMIT_FACTOR = 2.0;

    private static final RetryPolicy DEFAULTS = builder().build();
    private static final RetryPolicy POLLING = builder()
            .maxAttempts(40)
            .baseDelay(Duration.ofSeconds(1))
            .multiplier(1.5)
            .maxDelay(Duration.ofSeconds(6))
            .deadline(Duration.ofMinutes(2))
            .build();
    private static final RetryPolicy NO_RETRY = builder().maxAttempts(1).build();

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final double jitter;
    private final Duration maxDelay;
    private final @Nullable Duration deadline;
    private final double rateLimitFactor;
    private final DoubleSupplier random;

    private RetryPolicy(final Builder b) {
        if (b.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + b.maxAttempts);
        }
        Objects.requireNonNull(b.baseDelay, "baseDelay");
        Objects.requireNonNull(b.maxDelay, "maxDelay");
        if (b.baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0, got: " + b.baseDelay);
        }
        if (b.multiplier < 1.0 || Double.isNaN(b.multiplier)) {
            throw new IllegalArgumentException("multiplier must be >= 1, got: " + b.multiplier);
        }
        if (b.jitter < 0.0 || b.jitter >= 1.0 || Double.isNaN(b.jitter)) {
            throw new IllegalArgumentException("jitter must be in [0, 1), got: " + b.jitter);
        }
        if (b.maxDelay.compareTo(b.baseDelay) < 0) {
            throw new IllegalArgumentException(
                    "maxDelay must be >= baseDelay, got: " + b.maxDelay + " < " + b.baseDelay);
        }
        if (b.deadline != null && (b.deadline.isNegative() || b.deadline.isZero())) {
            throw new IllegalArgumentException("deadline must be > 0, got: " + b.deadline);
        }
        if (b.rateLimitFactor < 1.0 || Double.isNaN(b.rateLimitFactor)) {
            throw new IllegalArgumentException("rateLimitFactor must be >= 1, got: " + b.rateLimitFactor);
        }
        this.maxAttempts = b.maxAttempts;
        this.baseDelay = b.baseDelay;
        this.multiplier = b.multiplier;
        this.jitter = b.jitter;
        this.maxDelay = b.maxDelay;
        this.deadline = b.deadline;
        this.rateLimitFactor = b.rateLimitFactor;
        this.random = Objects.requireNonNull(b.random, "random");
    }

    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    public static RetryPolicy pollingDefaults() {
        return POLLING;
    }

    /** A policy that allows exactly one attempt. */
    public static RetryPolicy noRetry() {
        return NO_RETRY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        final Builder b = new Builder();
        b.maxAttempts = maxAttempts;
        b.baseDelay = baseDelay;
        b.multiplier = multiplier;
        b.jitter = jitter;
        b.maxDelay = maxDelay;
        b.deadline = deadline;
        b.rateLimitFactor = rateLimitFactor;
        b.random = random;
        return b;
    }

    /**
     * Delay before the attempt following {@code attemptIndex}, as if no time
     * had elapsed yet. A deadline still caps the delay at its full length.
     *
     * @param attemptIndex zero-based index of the attempt that just failed
     * @return the delay, or empty when attempts are exhausted
     */
    public Optional<Duration> nextDelay(final int attemptIndex) {
        return nextDelay(attemptIndex, ApiErrorKind.TRANSIENT, Duration.ZERO);
    }

    public Optional<Duration> nextDelay(final int attemptIndex, final Duration elapsed) {
        return nextDelay(attemptIndex, ApiErrorKind.TRANSIENT, elapsed);
    }

    /**
     * Delay before the attempt following {@code attemptIndex}.
     *
     * @param attemptIndex zero-based index of the attempt that just failed
     * @param kind         classification of that failure
     * @param elapsed      time spent since the first attempt started
     * @return the delay, or empty when attempts or the deadline are exhausted
     */
    public Optional<Duration> nextDelay(final int attemptIndex, final ApiErrorKind kind, final Duration elapsed) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0, got: " + attemptIndex);
        }
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(elapsed, "elapsed");
        if (attemptIndex + 1 >= maxAttempts) {
            return Optional.empty();
        }

        final double maxMillis = maxDelay.toMillis();
        double millis = Math.min(baseDelay.toMillis() * Math.pow(multiplier, attemptIndex), maxMillis);
        if (jitter > 0.0) {
            millis = millis * (1.0 + jitter * (2.0 * random.getAsDouble() - 1.0));
        }
        if (kind == ApiErrorKind.RATE_LIMITED) {
            millis = millis * rateLimitFactor;
        }
        Duration delay = Duration.ofMillis(Math.max(0L, Math.round(millis)));

        if (deadline != null) {
            final Duration remaining = deadline.minus(elapsed);
            if (remaining.isNegative() || remaining.isZero()) {
                return Optional.empty();
            }
            if (delay.compareTo(remaining) > 0) {
                delay = remaining;
            }
        }
        return Optional.of(delay);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public double multiplier() {
        return multiplier;
    }

    public double jitter() {
        return jitter;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public Optional<Duration> deadline() {
        return Optional.ofNullable(deadline);
    }

    public double rateLimitFactor() {
        return rateLimitFactor;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts
                + ", baseDelay=" + baseDelay.toMillis() + "ms"
                + ", multiplier=" + multiplier
                + ", jitter=" + jitter
                + ", maxDelay=" + maxDelay.toMillis() + "ms"
                + ", deadline=" + (deadline == null ? "none" : deadline.toMillis() + "ms")
                + ", rateLimitFactor=" + rateLimitFactor + "}";
    }

    /**
     * Builder for {@link RetryPolicy}. Unset values take the {@code DEFAULT_*} constants.
     */
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private double multiplier = DEFAULT_MULTIPLIER;
        private double jitter;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private @Nullable Duration deadline;
        private double rateLimitFactor = DEFAULT_RATE_LIMIT_FACTOR;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        private Builder() {}

        public Builder maxAttempts(final int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(final Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder multiplier(final double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        /**
         * Sets the jitter fraction; {@code 0.2} spreads each delay over ±20%.
         */
        public Builder jitter(final double jitter) {
            this.jitter = jitter;
            return this;
        }

        /** Caps a single delay before jitter and the rate-limit factor apply. */
        public Builder maxDelay(final Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        /** Overall time budget measured from the first attempt; {@code null} for none. */
        public Builder deadline(final @Nullable Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder rateLimitFactor(final double rateLimitFactor) {
            this.rateLimitFactor = rateLimitFactor;
            return this;
        }

        /** Source of uniform values in {@code [0, 1)} used for jitter. */
        public Builder random(final DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
