// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core;

/**
 * Formatter for gateway and transaction debug lines.
 *
 * <p>
 * All lines use a bracketed {@code [OPERATION]} tag, a status symbol
 * (✓ ✗ ○) where the outcome is known, shortened hashes
 * ({@code abcdef...1234}) and human-readable durations.
 *
 * <pre>{@code
 * DebugLogger.logRequest(LogFormatter.formatRequest("GET", "/network/config", 1_500));
 * // [REQUEST] GET /network/config 1.5ms
 *
 * DebugLogger.logRequest(LogFormatter.formatRequestError("POST", "/transaction/send", "FATAL", "insufficient funds", 900));
 * // ✗ [REQUEST-ERROR] POST /transaction/send kind=FATAL message=insufficient funds 900us
 * }</pre>
 *
 * <p>
 * All methods are pure and thread-safe.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;
    private static final int HASH_SUFFIX_LENGTH = 4;
    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    public static String formatRequest(final String method, final String path, final long durationMicros) {
        return String.format("[REQUEST] %s %s %s", method, path, duration(durationMicros));
    }

    public static String formatRequestError(
            final String method, final String path, final Object kind, final String message, final long durationMicros) {
        return String.format(
                "✗ [REQUEST-ERROR] %s %s kind=%s message=%s %s",
                method, path, kind, message, duration(durationMicros));
    }

    public static String formatRetry(final String operation, final int attempt, final Object kind, final long delayMillis) {
        return String.format("○ [RETRY] operation=%s attempt=%d kind=%s delay=%dms", operation, attempt, kind, delayMillis);
    }

    public static String formatTxSend(final String sender, final Object nonce, final int payloadBytes) {
        return String.format(
                "[TX-SEND] sender=%s nonce=%s payloadBytes=%d",
                shortenHash(sender), nonce, payloadBytes);
    }

    public static String formatTxHash(final String hash, final long durationMicros) {
        return String.format("[TX-HASH] hash=%s %s", shortenHash(hash), duration(durationMicros));
    }

    public static String formatTxPoll(final String hash, final int attempt, final String status) {
        return String.format("○ [TX-POLL] hash=%s attempt=%d status=%s", shortenHash(hash), attempt, status);
    }

    public static String formatTxFinal(final String hash, final String state, final int attempts) {
        final String symbol = "SUCCEEDED".equals(state) ? "✓" : "✗";
        return String.format("%s [TX-FINAL] hash=%s state=%s attempts=%d", symbol, shortenHash(hash), state, attempts);
    }

    public static String formatSimulator(final String action, final Object argument) {
        return String.format("[SIMULATOR] %s %s", action, argument);
    }

    /**
     * Shortens a long hash or address to {@code prefix...suffix}.
     *
     * @param value the value to shorten
     * @return the shortened value, or the input when it is short or null
     */
    public static String shortenHash(final String value) {
        if (value == null || value.length() <= HASH_SHORTEN_THRESHOLD + 3) {
            return value;
        }
        return value.substring(0, HASH_PREFIX_LENGTH) + "..." + value.substring(value.length() - HASH_SUFFIX_LENGTH);
    }

    static String duration(final long durationMicros) {
        if (durationMicros < 1_000) {
            return durationMicros + "us";
        }
        if (durationMicros < 1_000_000) {
            return String.format("%.1fms", durationMicros / 1_000.0);
        }
        return String.format("%.1fs", durationMicros / 1_000_000.0);
    }
}
