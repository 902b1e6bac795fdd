// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maps node-defined status strings to {@link TransactionStatus.Kind}.
 *
 * <p>
 * The set of status strings is an external contract owned by the node
 * software and grows over time, so the mapping is data rather than code.
 * Lookups are case-insensitive; strings the policy does not know classify as
 * {@link TransactionStatus.Kind#UNKNOWN}, which pollers treat as not terminal.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * TransactionStatusPolicy policy = TransactionStatusPolicy.builder()
 *     .pending("queued")
 *     .failed("reverted")
 *     .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class TransactionStatusPolicy {

    private static final TransactionStatusPolicy DEFAULTS = builder().build();

    private final Map<String, TransactionStatus.Kind> kinds;

    private TransactionStatusPolicy(final Map<String, TransactionStatus.Kind> kinds) {
        this.kinds = Collections.unmodifiableMap(new LinkedHashMap<>(kinds));
    }

    /**
     * Returns the mapping for the statuses current gateways report:
     * {@code pending}, {@code received}, {@code partially-executed} (pending);
     * {@code success}, {@code successful}, {@code executed} (success);
     * {@code fail}, {@code failed}, {@code reward-reverted} (failed);
     * {@code invalid} (invalid).
     *
     * @return the default policy
     */
    public static TransactionStatusPolicy defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public TransactionStatus classify(final String status) {
        Objects.requireNonNull(status, "status");
        final TransactionStatus.Kind kind = kinds.get(status.trim().toLowerCase(Locale.ROOT));
        return new TransactionStatus(status, kind == null ? TransactionStatus.Kind.UNKNOWN : kind);
    }

    /** Returns the configured mapping (lower-case keys). */
    public Map<String, TransactionStatus.Kind> kinds() {
        return kinds;
    }

    /**
     * Builder seeded with the default mapping; later registrations override earlier ones.
     */
    public static final class Builder {
        private final Map<String, TransactionStatus.Kind> kinds = new LinkedHashMap<>();

        private Builder() {
            pending("pending", "received", "partially-executed");
            success("success", "successful", "executed");
            failed("fail", "failed", "reward-reverted");
            invalid("invalid");
        }

        public Builder pending(final String... statuses) {
            return register(TransactionStatus.Kind.PENDING, statuses);
        }

        public Builder success(final String... statuses) {
            return register(TransactionStatus.Kind.SUCCESS, statuses);
        }

        public Builder failed(final String... statuses) {
            return register(TransactionStatus.Kind.FAILED, statuses);
        }

        public Builder invalid(final String... statuses) {
            return register(TransactionStatus.Kind.INVALID, statuses);
        }

        public Builder clear() {
            kinds.clear();
            return this;
        }

        private Builder register(final TransactionStatus.Kind kind, final String... statuses) {
            for (String status : statuses) {
                Objects.requireNonNull(status, "status");
                if (status.isBlank()) {
                    throw new IllegalArgumentException("status cannot be blank");
                }
                kinds.put(status.trim().toLowerCase(Locale.ROOT), kind);
            }
            return this;
        }

        public TransactionStatusPolicy build() {
            return new TransactionStatusPolicy(kinds);
        }
    }
}
