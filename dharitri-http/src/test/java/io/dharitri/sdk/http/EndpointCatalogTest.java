// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.dharitri.sdk.core.error.ApiErrorKind;
import io.dharitri.sdk.core.error.ApiException;

class EndpointCatalogTest {

    private final EndpointCatalog v1 = EndpointCatalog.forVersion(ApiVersion.V1);
    private final EndpointCatalog v2 = EndpointCatalog.forVersion(ApiVersion.V2);

    @Test
    void resolvesAccountPath() {
        Endpoint endpoint = v1.resolve(Operation.GET_ACCOUNT, Map.of("address", "drt1abc"));
        assertEquals(HttpMethod.GET, endpoint.method());
        assertEquals("/address/drt1abc", endpoint.path());
        assertEquals("GET /address/drt1abc", endpoint.toString());
    }

    @Test
    void sendIsPost() {
        Endpoint endpoint = v1.resolve(Operation.SEND_TRANSACTION, Map.of());
        assertEquals(HttpMethod.POST, endpoint.method());
        assertEquals("/transaction/send", endpoint.path());
    }

    @Test
    void transactionQueryCarriesWithResults() {
        Endpoint endpoint = v1.resolve(Operation.GET_TRANSACTION, Map.of("hash", "ab12", "withResults", "true"));
        assertEquals("/transaction/ab12?withResults=true", endpoint.path());
    }

    @Test
    void versionsDifferOnlyWhereTablesDiffer() {
        assertEquals("/dcdt/WREWA-abc123", v1.resolve(Operation.GET_TOKEN, Map.of("identifier", "WREWA-abc123")).path());
        assertEquals("/tokens/WREWA-abc123", v2.resolve(Operation.GET_TOKEN, Map.of("identifier", "WREWA-abc123")).path());
        assertEquals("/transaction/ab/status", v1.resolve(Operation.GET_TRANSACTION_STATUS, Map.of("hash", "ab")).path());
        assertEquals("/transaction/ab/process-status",
                v2.resolve(Operation.GET_TRANSACTION_STATUS, Map.of("hash", "ab")).path());
        assertEquals(v1.resolve(Operation.GET_NETWORK_CONFIG, Map.of()), v2.resolve(Operation.GET_NETWORK_CONFIG, Map.of()));
    }

    @Test
    void parametersAreUrlEncoded() {
        Endpoint endpoint = v1.resolve(Operation.GET_HYPER_BLOCK_BY_HASH, Map.of("hash", "a b/c?d"));
        assertEquals("/hyperblock/by-hash/a%20b%2Fc%3Fd", endpoint.path());
    }

    @Test
    void missingParameterIsFatal() {
        ApiException ex = assertThrows(ApiException.class, () -> v1.resolve(Operation.GET_ACCOUNT, Map.of()));
        assertEquals(ApiErrorKind.FATAL, ex.kind());
        assertTrue(ex.getMessage().contains("address"));

        assertThrows(ApiException.class, () -> v1.resolve(Operation.GET_ACCOUNT, Map.of("address", " ")));
        assertThrows(ApiException.class, () -> v1.resolve(Operation.GET_ACCOUNT, null));
    }

    @Test
    void productionCatalogRefusesSimulatorOperations() {
        ApiException ex = assertThrows(ApiException.class,
                () -> v1.resolve(Operation.SIMULATOR_GENERATE_BLOCKS, Map.of("count", "1")));
        assertEquals(ApiErrorKind.FATAL, ex.kind());
        assertFalse(v1.supports(Operation.SIMULATOR_GENERATE_BLOCKS));
        assertFalse(v1.isSimulatorEnabled());
    }

    @Test
    void simulatorCatalogResolvesControlEndpoints() {
        EndpointCatalog simulator = new EndpointCatalog(ApiVersion.V1, true);
        assertTrue(simulator.supports(Operation.SIMULATOR_GENERATE_BLOCKS));
        assertEquals("/simulator/generate-blocks/3",
                simulator.resolve(Operation.SIMULATOR_GENERATE_BLOCKS, Map.of("count", "3")).path());
        assertEquals("/simulator/generate-blocks-until-epoch-reached/4",
                simulator.resolve(Operation.SIMULATOR_GENERATE_BLOCKS_UNTIL_EPOCH, Map.of("epoch", "4")).path());
        assertEquals(HttpMethod.POST,
                simulator.resolve(Operation.SIMULATOR_GENERATE_BLOCKS_UNTIL_TX_PROCESSED, Map.of("hash", "ab")).method());
    }

    @Test
    void resolvesByName() {
        assertEquals("/network/config", v1.resolve("get-network-config", Map.of()).path());
        assertEquals("/address/x", v1.resolve("GET_ACCOUNT", Map.of("address", "x")).path());

        ApiException ex = assertThrows(ApiException.class, () -> v1.resolve("get-everything", Map.of()));
        assertEquals(ApiErrorKind.FATAL, ex.kind());
        assertTrue(ex.getMessage().contains("Unknown operation"));
        assertThrows(ApiException.class, () -> v1.resolve(" ", Map.of()));
    }
}
