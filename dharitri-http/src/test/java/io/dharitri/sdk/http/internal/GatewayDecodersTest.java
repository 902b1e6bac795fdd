// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http.internal;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import io.dharitri.sdk.core.error.DecodeException;
import io.dharitri.sdk.core.model.AccountInfo;
import io.dharitri.sdk.core.model.HyperBlock;
import io.dharitri.sdk.core.model.NetworkConfig;
import io.dharitri.sdk.core.model.NetworkEconomics;
import io.dharitri.sdk.core.model.NetworkStatus;
import io.dharitri.sdk.core.model.TokenMetadata;
import io.dharitri.sdk.core.model.TransactionOnNetwork;
import io.dharitri.sdk.core.model.TransactionStatus;
import io.dharitri.sdk.core.model.TransactionStatusPolicy;
import io.dharitri.sdk.core.types.TxHash;

class GatewayDecodersTest {

    private static final String ADDRESS = "drt1qyu5wthldzr8wx5c9ucg8kjagg0jfs53s8nr3zpz3hypefsdd8ssycr6th";
    private static final TxHash HASH = new TxHash("ab".repeat(32));

    @Test
    void decodesNetworkConfigWithEitherPrefix() {
        NetworkConfig config = GatewayDecoders.networkConfig(payload("""
                {"data":{"config":{
                  "drt_chain_id":"D","erd_min_gas_price":1000000000,"erd_min_gas_limit":50000,
                  "erd_gas_per_data_byte":1500,"erd_min_transaction_version":1,"erd_round_duration":6000,
                  "erd_num_shards_without_meta":3,"erd_start_time":1694000000}}}
                """));

        assertEquals("D", config.chainId());
        assertEquals(1_000_000_000L, config.minGasPrice());
        assertEquals(50_000L, config.minGasLimit());
        assertEquals(3, config.numShards());
        assertNull(config.currentEpoch());
    }

    @Test
    void networkConfigRequiresChainId() {
        assertThrows(DecodeException.class, () -> GatewayDecoders.networkConfig(payload(
                "{\"data\":{\"config\":{\"erd_min_gas_price\":1}}}")));
    }

    @Test
    void decodesEconomicsKeepingAmountsExact() {
        NetworkEconomics economics = GatewayDecoders.networkEconomics(payload("""
                {"data":{"metrics":{
                  "erd_total_supply":"20000000000000000000000000","erd_total_fees":"1","erd_dev_rewards":"2",
                  "erd_epoch_for_economics_data":1200,"erd_inflation":"123456789012345678901",
                  "erd_total_staked_value":"5"}}}
                """));

        assertEquals("20000000000000000000000000", economics.totalSupply());
        assertEquals("123456789012345678901", economics.inflation());
        assertEquals("5", economics.staked());
        assertNull(economics.circulatingSupply());
        assertEquals(1200L, economics.epochForEconomics());
    }

    @Test
    void decodesNetworkStatus() {
        NetworkStatus status = GatewayDecoders.networkStatus(payload("""
                {"data":{"status":{"erd_current_round":"200","erd_epoch_number":3,"erd_nonce":199,
                  "erd_highest_final_nonce":198}}}
                """), NetworkStatus.METACHAIN_SHARD);

        assertEquals(NetworkStatus.METACHAIN_SHARD, status.shard());
        assertEquals(200L, status.currentRound());
        assertEquals(198L, status.highestFinalNonce());
        assertEquals(0L, status.roundsPerEpoch());
    }

    @Test
    void decodesAccountFromBareObject() {
        AccountInfo account = GatewayDecoders.account(
                payload("{\"account\":{\"balance\":\"100\",\"nonce\":5}}"), ADDRESS);

        assertEquals(ADDRESS, account.address());
        assertEquals("100", account.balance());
        assertEquals(5L, account.nonce());
    }

    @Test
    void numericBalanceKeepsExactDigits() {
        AccountInfo account = GatewayDecoders.account(
                payload("{\"data\":{\"account\":{\"balance\":123456789012345678901234567890,\"nonce\":\"9\"}}}"),
                ADDRESS);
        assertEquals("123456789012345678901234567890", account.balance());
        assertEquals(9L, account.nonce());
    }

    @Test
    void accountRequiresBalanceAndNonce() {
        assertThrows(DecodeException.class,
                () -> GatewayDecoders.account(payload("{\"account\":{\"nonce\":5}}"), ADDRESS));
        assertThrows(DecodeException.class,
                () -> GatewayDecoders.account(payload("{\"account\":{\"balance\":\"1\",\"nonce\":\"five\"}}"), ADDRESS));
        assertThrows(DecodeException.class,
                () -> GatewayDecoders.account(payload("{\"account\":{\"balance\":{},\"nonce\":1}}"), ADDRESS));
    }

    @Test
    void decodesTransactionWithResults() {
        TransactionOnNetwork tx = GatewayDecoders.transaction(payload("""
                {"data":{"transaction":{"sender":"drt1a","receiver":"drt1b","nonce":7,"value":"1000",
                  "status":"success","blockNonce":42,"round":43,"blockHash":"ff",
                  "logs":{"events":[]},"smartContractResults":[{"nonce":8},{"nonce":9}]}}}
                """), HASH, TransactionStatusPolicy.defaults());

        assertEquals(HASH, tx.hash());
        assertEquals(TransactionStatus.Kind.SUCCESS, tx.status().kind());
        assertEquals(42L, tx.blockNonce());
        assertTrue(tx.isIncluded());
        assertEquals(2, tx.smartContractResults().size());
        assertNotNull(tx.logs());
    }

    @Test
    void decodesSentHash() {
        assertEquals(HASH, GatewayDecoders.txHash(payload("{\"data\":{\"txHash\":\"" + HASH.value() + "\"}}")));
        assertThrows(DecodeException.class, () -> GatewayDecoders.txHash(payload("{\"data\":{\"txHash\":\"zz\"}}")));
        assertThrows(DecodeException.class, () -> GatewayDecoders.txHash(payload("{\"data\":{}}")));
    }

    @Test
    void decodesTokenAndDerivesTicker() {
        TokenMetadata token = GatewayDecoders.token(payload("""
                {"data":{"tokenData":{"tokenName":"WrappedRewa","numDecimals":18,"owner":"drt1o",
                  "type":"FungibleDCDT","canMint":true,"canFreeze":false}}}
                """), "WREWA-bd4d79");

        assertEquals("WREWA-bd4d79", token.identifier());
        assertEquals("WREWA", token.ticker());
        assertEquals("WrappedRewa", token.name());
        assertEquals(18, token.decimals());
        assertEquals("true", token.properties().get("canMint"));
        assertEquals("false", token.properties().get("canFreeze"));
    }

    @Test
    void decodesHyperBlock() {
        HyperBlock block = GatewayDecoders.hyperBlock(payload("""
                {"data":{"hyperblock":{"nonce":100,"round":101,"epoch":2,"hash":"aa","prevBlockHash":"bb",
                  "timestamp":1694000600,"numTxs":1,"transactions":[{"hash":"cc"}]}}}
                """));

        assertEquals(100L, block.nonce());
        assertEquals("bb", block.prevBlockHash());
        assertEquals(1, block.transactions().size());
        assertThrows(DecodeException.class, () -> GatewayDecoders.hyperBlock(payload("{\"hyperblock\":{\"nonce\":1}}")));
    }

    private static JsonNode payload(final String body) {
        return GatewayEnvelope.parse(body).data();
    }
}
