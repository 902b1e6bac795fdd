// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import io.dharitri.sdk.core.types.TxHash;

/**
 * A signed transaction ready for broadcast.
 *
 * <p>
 * The payload is the already-serialized, signed JSON produced by the
 * transaction builder; the gateway client sends it verbatim and never inspects
 * or rewrites it. The sender and nonce are carried alongside so that a failed
 * broadcast can be reported with enough context for the caller to decide on
 * resubmission.
 *
 * <p>
 * Instances are immutable. The hash is unknown until the gateway accepts the
 * transaction; {@link #withHash(TxHash)} returns a copy carrying it.
 *
 * @since 0.1.0
 */
public final class TransactionRequest {

    private final String sender;
    private final @Nullable Long nonce;
    private final byte[] payload;
    private final @Nullable TxHash hash;

    private TransactionRequest(
            final String sender, final @Nullable Long nonce, final byte[] payload, final @Nullable TxHash hash) {
        this.sender = Objects.requireNonNull(sender, "sender cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        if (payload.length == 0) {
            throw new IllegalArgumentException("payload cannot be empty");
        }
        this.nonce = nonce;
        this.payload = payload.clone();
        this.hash = hash;
    }

    public static TransactionRequest of(final String sender, final @Nullable Long nonce, final byte[] signedPayload) {
        return new TransactionRequest(sender, nonce, signedPayload, null);
    }

    public static TransactionRequest ofJson(final String sender, final @Nullable Long nonce, final String signedJson) {
        Objects.requireNonNull(signedJson, "signedJson cannot be null");
        return of(sender, nonce, signedJson.getBytes(StandardCharsets.UTF_8));
    }

    public String sender() {
        return sender;
    }

    public Optional<Long> nonce() {
        return Optional.ofNullable(nonce);
    }

    /** Returns a copy of the serialized signed payload. */
    public byte[] payload() {
        return payload.clone();
    }

    public Optional<TxHash> hash() {
        return Optional.ofNullable(hash);
    }

    public TransactionRequest withHash(final TxHash txHash) {
        Objects.requireNonNull(txHash, "txHash");
        return new TransactionRequest(sender, nonce, payload, txHash);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransactionRequest other)) {
            return false;
        }
        return sender.equals(other.sender)
                && Objects.equals(nonce, other.nonce)
                && Arrays.equals(payload, other.payload)
                && Objects.equals(hash, other.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sender, nonce, Arrays.hashCode(payload), hash);
    }

    @Override
    public String toString() {
        return "TransactionRequest{sender=" + sender
                + ", nonce=" + nonce
                + ", payloadBytes=" + payload.length
                + ", hash=" + hash + "}";
    }
}
