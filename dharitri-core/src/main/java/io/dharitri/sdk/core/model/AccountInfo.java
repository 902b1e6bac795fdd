// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.model;

import java.math.BigInteger;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Snapshot of an account as reported by {@code GET /address/{address}}.
 *
 * <p>
 * The balance is kept as the exact decimal string returned by the node so that
 * no precision is lost; {@link #balanceValue()} parses it on demand. Every
 * query yields a fresh instance.
 *
 * @param address          the bech32 address
 * @param balance          balance in the smallest denomination, as a decimal string
 * @param nonce            next nonce expected from this account
 * @param username         registered username, if any
 * @param code             deployed code (hex) for smart contracts, if any
 * @param codeHash         hash of the deployed code, if any
 * @param rootHash         storage root hash, if any
 * @param developerReward  accumulated developer reward, if any
 * @param ownerAddress     owner of a smart contract, if any
 * @since 0.1.0
 */
public record AccountInfo(
        String address,
        String balance,
        long nonce,
        @Nullable String username,
        @Nullable String code,
        @Nullable String codeHash,
        @Nullable String rootHash,
        @Nullable String developerReward,
        @Nullable String ownerAddress) {

    public AccountInfo {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(balance, "balance cannot be null");
        if (nonce < 0) {
            throw new IllegalArgumentException("nonce must be >= 0, got: " + nonce);
        }
    }

    public BigInteger balanceValue() {
        return new BigInteger(balance);
    }

    public boolean isSmartContract() {
        return code != null && !code.isEmpty();
    }
}
