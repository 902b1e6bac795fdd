// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.time.Duration;
import java.time.Instant;

/**
 * Time source and sleeper for retry and polling loops; replaced in tests.
 */
interface BackoffClock {

    long nanoTime();

    Instant instant();

    void sleep(Duration duration) throws InterruptedException;

    BackoffClock SYSTEM = new BackoffClock() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public Instant instant() {
            return Instant.now();
        }

        @Override
        public void sleep(final Duration duration) throws InterruptedException {
            if (!duration.isZero() && !duration.isNegative()) {
                Thread.sleep(duration.toMillis());
            } else if (Thread.interrupted()) {
                throw new InterruptedException();
            }
        }
    };
}
