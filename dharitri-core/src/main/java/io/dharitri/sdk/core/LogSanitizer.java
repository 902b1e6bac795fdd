// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts signatures and secret keys carried in transaction JSON</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Logs exceeding this will be truncated.
     */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern SENSITIVE_FIELD = Pattern.compile(
            "\"(signature|guardianSignature|relayerSignature|secretKey|privateKey)\"\\s*:\\s*\"[^\"]+\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.indexOf('"') >= 0) {
            sanitized = SENSITIVE_FIELD.matcher(sanitized).replaceAll("\"$1\":\"***[REDACTED]***\"");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
