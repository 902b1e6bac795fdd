// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.types;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Bech32 account address as accepted by the gateway (e.g. {@code drt1...}).
 *
 * <p>Only the textual shape is checked here; checksum verification belongs to
 * the address codec that produced the value.
 */
public record Address(String value) {
    private static final Pattern BECH32 = Pattern.compile("^[a-z]{1,83}1[02-9ac-hj-np-z]{6,}$");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!BECH32.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid bech32 address: " + value);
        }
    }

    /** Human-readable part before the separator, e.g. {@code drt}. */
    public String hrp() {
        return value.substring(0, value.lastIndexOf('1'));
    }

    @Override
    public String toString() {
        return value;
    }
}
