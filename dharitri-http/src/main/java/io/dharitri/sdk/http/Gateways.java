// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

/**
 * Well-known gateway base URLs.
 */
public final class Gateways {

    public static final String MAINNET_GATEWAY = "https://gateway.dharitri.org";
    public static final String TESTNET_GATEWAY = "https://testnet-gateway.dharitri.org";
    public static final String DEVNET_GATEWAY = "https://devnet-gateway.dharitri.org";

    /** Default listen address of a locally started chain simulator. */
    public static final String LOCAL_SIMULATOR = "http://localhost:8085";

    private Gateways() {
    }
}
