// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.dharitri.sdk.core.DharitriDebug.Channel;

/**
 * Writes trace lines to the {@code io.dharitri.debug} logger.
 *
 * <p>A line is emitted only when its {@link DharitriDebug} channel is on, and
 * always passes through {@link LogSanitizer}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.dharitri.debug");

    private DebugLogger() {
    }

    public static void logRequest(final String message) {
        log(Channel.REQUEST, message);
    }

    public static void logTx(final String message) {
        log(Channel.TX, message);
    }

    public static void logRetry(final String message) {
        log(Channel.RETRY, message);
    }

    public static void logSimulator(final String message) {
        log(Channel.SIMULATOR, message);
    }

    public static void log(final Channel channel, final String message) {
        if (!DharitriDebug.isEnabled(channel)) {
            return;
        }
        LOG.info(LogSanitizer.sanitize(message));
    }
}
