// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.dharitri.sdk.core.error.ApiError;
import io.dharitri.sdk.core.error.ApiErrorKind;
import io.dharitri.sdk.core.error.ApiException;

class RetryRunnerTest {

    private final FakeClock clock = new FakeClock();
    private final RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(3)
            .baseDelay(Duration.ofMillis(100))
            .multiplier(2.0)
            .build();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void returnsFirstSuccessWithoutSleeping() {
        AtomicInteger calls = new AtomicInteger();
        String result = RetryRunner.run("op", () -> {
            calls.incrementAndGet();
            return "ok";
        }, policy, clock);

        assertEquals("ok", result);
        assertEquals(1, calls.get());
        assertTrue(clock.sleeps.isEmpty());
    }

    @Test
    void retriesTransientThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        String result = RetryRunner.run("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw failure(ApiErrorKind.TRANSIENT);
            }
            return "ok";
        }, policy, clock);

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), clock.sleeps);
    }

    @Test
    void fatalIsNeverRetried() {
        AtomicInteger calls = new AtomicInteger();
        ApiException ex = assertThrows(ApiException.class, () -> RetryRunner.run("op", () -> {
            calls.incrementAndGet();
            throw failure(ApiErrorKind.FATAL);
        }, policy, clock));

        assertEquals(ApiErrorKind.FATAL, ex.kind());
        assertEquals(1, calls.get());
        assertTrue(clock.sleeps.isEmpty());
    }

    @Test
    void decodeIsNeverRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(ApiException.class, () -> RetryRunner.run("op", () -> {
            calls.incrementAndGet();
            throw failure(ApiErrorKind.DECODE);
        }, policy, clock));
        assertEquals(1, calls.get());
    }

    @Test
    void exhaustionReportsTimedOutWithHistory() {
        AtomicInteger calls = new AtomicInteger();
        ApiException ex = assertThrows(ApiException.class, () -> RetryRunner.run("GET /network/config", () -> {
            calls.incrementAndGet();
            throw failure(calls.get() == 3 ? ApiErrorKind.TIMEOUT : ApiErrorKind.TRANSIENT);
        }, policy, clock));

        assertEquals(ApiErrorKind.TIMED_OUT, ex.kind());
        assertEquals(3, calls.get());
        assertInstanceOf(ApiException.class, ex.getCause());
        assertEquals(ApiErrorKind.TIMEOUT, ((ApiException) ex.getCause()).kind());
        assertEquals(2, ex.getSuppressed().length);
        assertTrue(ex.getMessage().contains("3 attempt(s)"));
        assertEquals(Duration.ofMillis(300), clock.totalSlept());
    }

    @Test
    void rateLimitedWaitsLonger() {
        AtomicInteger calls = new AtomicInteger();
        RetryRunner.run("op", () -> {
            if (calls.incrementAndGet() == 1) {
                throw failure(ApiErrorKind.RATE_LIMITED);
            }
            return "ok";
        }, policy, clock);

        assertEquals(List.of(Duration.ofMillis(200)), clock.sleeps);
    }

    @Test
    void interruptDuringBackoffCancels() {
        AtomicInteger calls = new AtomicInteger();
        ApiException ex = assertThrows(ApiException.class, () -> RetryRunner.run("op", () -> {
            calls.incrementAndGet();
            Thread.currentThread().interrupt();
            throw failure(ApiErrorKind.TRANSIENT);
        }, policy, clock));

        assertEquals(ApiErrorKind.CANCELLED, ex.kind());
        assertEquals(1, calls.get());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    private static ApiException failure(final ApiErrorKind kind) {
        return new ApiException(new ApiError(kind, kind + " failure", null, 0));
    }
}
