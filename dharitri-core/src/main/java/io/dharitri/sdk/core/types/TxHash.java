// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.types;

import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Hex-encoded 32-byte transaction hash, as returned by the gateway (no {@code 0x} prefix).
 */
public record TxHash(String value) {
    private static final Pattern HEX = Pattern.compile("^[0-9a-fA-F]{64}$");

    public TxHash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid transaction hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(value);
    }

    public static TxHash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != 32) {
            throw new IllegalArgumentException("Transaction hash must be exactly 32 bytes");
        }
        return new TxHash(HexFormat.of().formatHex(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
