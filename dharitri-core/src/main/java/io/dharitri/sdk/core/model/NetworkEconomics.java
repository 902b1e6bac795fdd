// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Economic figures reported by {@code GET /network/economics}.
 *
 * <p>Amounts are kept as the decimal strings the node returned. Figures that
 * older gateways omit are {@code null}.
 *
 * @param totalSupply        total supply
 * @param circulatingSupply  circulating supply
 * @param staked             total staked value
 * @param totalFees          fees collected so far
 * @param devRewards         developer rewards in the current epoch
 * @param epochForEconomics  epoch the figures refer to
 * @param inflation          inflation for the current epoch
 * @param totalBaseStakedValue base staked value
 * @param totalTopUpValue    top-up value
 */
public record NetworkEconomics(
        String totalSupply,
        @Nullable String circulatingSupply,
        @Nullable String staked,
        String totalFees,
        String devRewards,
        long epochForEconomics,
        String inflation,
        @Nullable String totalBaseStakedValue,
        @Nullable String totalTopUpValue) {

    public NetworkEconomics {
        Objects.requireNonNull(totalSupply, "totalSupply");
        Objects.requireNonNull(totalFees, "totalFees");
        Objects.requireNonNull(devRewards, "devRewards");
        Objects.requireNonNull(inflation, "inflation");
    }
}
