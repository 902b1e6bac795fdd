// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.model;

import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Metadata of a DCDT token.
 *
 * @param identifier  token identifier (e.g. {@code WDRT-bd4d79})
 * @param name        token name
 * @param ticker      ticker
 * @param owner       owner address, if reported
 * @param decimals    number of decimals
 * @param type        token type (e.g. {@code FungibleDCDT}), if reported
 * @param supply      current supply as a decimal string, if reported
 * @param properties  remaining boolean/string properties, verbatim
 */
public record TokenMetadata(
        String identifier,
        String name,
        String ticker,
        @Nullable String owner,
        int decimals,
        @Nullable String type,
        @Nullable String supply,
        Map<String, String> properties) {

    public TokenMetadata {
        Objects.requireNonNull(identifier, "identifier cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(ticker, "ticker cannot be null");
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must be >= 0, got: " + decimals);
        }
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
