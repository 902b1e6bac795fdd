// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

/**
 * Logical gateway operations known to the {@link EndpointCatalog}.
 *
 * <p>Each operation declares whether it is safe to repeat
 * ({@link #isIdempotent()}) and whether it exists only on a chain simulator
 * ({@link #isSimulatorOnly()}).
 */
public enum Operation {
    GET_NETWORK_CONFIG(true, false),
    GET_NETWORK_ECONOMICS(true, false),
    GET_NETWORK_STATUS(true, false),
    GET_ACCOUNT(true, false),
    SEND_TRANSACTION(false, false),
    GET_TRANSACTION(true, false),
    GET_TRANSACTION_STATUS(true, false),
    GET_TOKEN(true, false),
    GET_HYPER_BLOCK_BY_NONCE(true, false),
    GET_HYPER_BLOCK_BY_HASH(true, false),
    SIMULATOR_GENERATE_BLOCKS(false, true),
    SIMULATOR_GENERATE_BLOCKS_UNTIL_TX_PROCESSED(false, true),
    SIMULATOR_GENERATE_BLOCKS_UNTIL_EPOCH(false, true);

    private final boolean idempotent;
    private final boolean simulatorOnly;

    Operation(final boolean idempotent, final boolean simulatorOnly) {
        this.idempotent = idempotent;
        this.simulatorOnly = simulatorOnly;
    }

    /** Whether repeating the request cannot change chain state. */
    public boolean isIdempotent() {
        return idempotent;
    }

    public boolean isSimulatorOnly() {
        return simulatorOnly;
    }
}
