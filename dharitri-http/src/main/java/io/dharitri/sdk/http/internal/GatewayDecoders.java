// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http.internal;

import static io.dharitri.sdk.http.internal.GatewayJson.array;
import static io.dharitri.sdk.http.internal.GatewayJson.metricLong;
import static io.dharitri.sdk.http.internal.GatewayJson.metricText;
import static io.dharitri.sdk.http.internal.GatewayJson.objectOrSelf;
import static io.dharitri.sdk.http.internal.GatewayJson.optionalLong;
import static io.dharitri.sdk.http.internal.GatewayJson.optionalText;
import static io.dharitri.sdk.http.internal.GatewayJson.requireLong;
import static io.dharitri.sdk.http.internal.GatewayJson.requireMetricLong;
import static io.dharitri.sdk.http.internal.GatewayJson.requireMetricText;
import static io.dharitri.sdk.http.internal.GatewayJson.requireText;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

import io.dharitri.sdk.core.InternalApi;
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

/**
 * Decodes envelope payloads into domain records.
 *
 * <p>
 * Every method takes the envelope's {@code data} object. Required fields that
 * are missing or mistyped raise {@link DecodeException}; no defaults are
 * substituted for them.
 */
@InternalApi
public final class GatewayDecoders {

    private GatewayDecoders() {
        // Utility class - prevent instantiation
    }

    public static NetworkConfig networkConfig(final JsonNode payload) {
        final JsonNode config = objectOrSelf(payload, "config");
        return wrap("network config", () -> new NetworkConfig(
                requireMetricText(config, "chain_id"),
                requireMetricLong(config, "min_gas_price"),
                requireMetricLong(config, "min_gas_limit"),
                requireMetricLong(config, "gas_per_data_byte"),
                (int) metricLong(config, "min_transaction_version", 1),
                requireMetricLong(config, "round_duration"),
                (int) metricLong(config, "num_shards_without_meta", 0),
                metricLong(config, "start_time", 0),
                nullableMetricLong(config, "epoch_number"),
                nullableMetricLong(config, "current_round")));
    }

    public static NetworkEconomics networkEconomics(final JsonNode payload) {
        final JsonNode metrics = objectOrSelf(payload, "metrics");
        return wrap("network economics", () -> new NetworkEconomics(
                requireMetricText(metrics, "total_supply"),
                metricText(metrics, "circulating_supply"),
                metricText(metrics, "total_staked_value"),
                requireMetricText(metrics, "total_fees"),
                requireMetricText(metrics, "dev_rewards"),
                requireMetricLong(metrics, "epoch_for_economics_data"),
                requireMetricText(metrics, "inflation"),
                metricText(metrics, "total_base_staked_value"),
                metricText(metrics, "total_top_up_value")));
    }

    public static NetworkStatus networkStatus(final JsonNode payload, final long shard) {
        final JsonNode status = objectOrSelf(payload, "status");
        return wrap("network status", () -> new NetworkStatus(
                shard,
                requireMetricLong(status, "current_round"),
                requireMetricLong(status, "epoch_number"),
                requireMetricLong(status, "nonce"),
                metricLong(status, "highest_final_nonce", 0),
                metricLong(status, "nonce_at_epoch_start", 0),
                metricLong(status, "rounds_per_epoch", 0)));
    }

    /**
     * Decodes {@code data.account}. The balance keeps the exact decimal text the
     * node sent; a missing address falls back to the one requested.
     */
    public static AccountInfo account(final JsonNode payload, final String requestedAddress) {
        final JsonNode account = objectOrSelf(payload, "account");
        final String address = optionalText(account, "address");
        return wrap("account", () -> new AccountInfo(
                address != null ? address : requestedAddress,
                requireText(account, "balance"),
                requireLong(account, "nonce"),
                optionalText(account, "username"),
                optionalText(account, "code"),
                optionalText(account, "codeHash"),
                optionalText(account, "rootHash"),
                optionalText(account, "developerReward"),
                optionalText(account, "ownerAddress")));
    }

    public static TxHash txHash(final JsonNode payload) {
        final String hash = requireText(payload, "txHash");
        return wrap("transaction hash", () -> new TxHash(hash));
    }

    public static TransactionOnNetwork transaction(
            final JsonNode payload, final TxHash requestedHash, final TransactionStatusPolicy policy) {
        final JsonNode tx = objectOrSelf(payload, "transaction");
        final String hash = optionalText(tx, "hash");
        final JsonNode logs = tx.get("logs");
        return wrap("transaction", () -> new TransactionOnNetwork(
                hash != null ? new TxHash(hash) : requestedHash,
                requireText(tx, "sender"),
                requireText(tx, "receiver"),
                requireLong(tx, "nonce"),
                requireText(tx, "value"),
                policy.classify(requireText(tx, "status")),
                optionalLong(tx, "blockNonce"),
                optionalLong(tx, "round"),
                optionalText(tx, "blockHash"),
                logs == null || logs.isNull() ? null : logs,
                array(tx, "smartContractResults")));
    }

    public static TransactionStatus transactionStatus(final JsonNode payload, final TransactionStatusPolicy policy) {
        return policy.classify(requireText(payload, "status"));
    }

    public static TokenMetadata token(final JsonNode payload, final String requestedIdentifier) {
        final JsonNode node = objectOrSelf(objectOrSelf(payload, "token"), "tokenData");
        final String identifier = firstText(node, requestedIdentifier, "identifier", "tokenIdentifier");
        final String ticker = firstText(node, tickerOf(identifier), "ticker");
        final String name = firstText(node, null, "name", "tokenName");
        if (name == null) {
            throw new DecodeException("Missing required field 'name'");
        }
        final Long decimals = optionalLong(node, "decimals");
        final Long numDecimals = optionalLong(node, "numDecimals");
        return wrap("token", () -> new TokenMetadata(
                identifier,
                name,
                ticker,
                optionalText(node, "owner"),
                decimals != null ? decimals.intValue() : numDecimals != null ? numDecimals.intValue() : 0,
                firstText(node, null, "type", "tokenType"),
                firstText(node, null, "supply", "mintedValue"),
                properties(node)));
    }

    public static HyperBlock hyperBlock(final JsonNode payload) {
        final JsonNode block = objectOrSelf(payload, "hyperblock");
        final Long timestamp = optionalLong(block, "timestamp");
        final Long numTxs = optionalLong(block, "numTxs");
        return wrap("hyper block", () -> new HyperBlock(
                requireLong(block, "nonce"),
                requireLong(block, "round"),
                requireLong(block, "epoch"),
                requireText(block, "hash"),
                requireText(block, "prevBlockHash"),
                timestamp == null ? 0 : timestamp,
                numTxs == null ? 0 : numTxs.intValue(),
                array(block, "transactions")));
    }

    private static @Nullable Long nullableMetricLong(final JsonNode node, final String suffix) {
        return GatewayJson.metric(node, suffix) == null ? null : requireMetricLong(node, suffix);
    }

    private static @Nullable String firstText(final JsonNode node, final @Nullable String fallback, final String... fields) {
        for (String field : fields) {
            final String value = optionalText(node, field);
            if (value != null) {
                return value;
            }
        }
        return fallback;
    }

    private static String tickerOf(final String identifier) {
        final int dash = identifier.indexOf('-');
        return dash > 0 ? identifier.substring(0, dash) : identifier;
    }

    // Boolean capability flags (canMint, canFreeze...) plus an explicit "properties" object if present.
    private static Map<String, String> properties(final JsonNode node) {
        final Map<String, String> result = new LinkedHashMap<>();
        final JsonNode explicit = node.get("properties");
        if (explicit != null && explicit.isObject()) {
            final Iterator<Map.Entry<String, JsonNode>> fields = explicit.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> entry = fields.next();
                result.put(entry.getKey(), entry.getValue().asText());
            }
        }
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getValue().isBoolean()) {
                result.putIfAbsent(entry.getKey(), Boolean.toString(entry.getValue().booleanValue()));
            }
        }
        return result;
    }

    /** Runs a record constructor, turning its validation failures into decode failures. */
    private static <T> T wrap(final String what, final Supplier<T> factory) {
        try {
            return factory.get();
        } catch (DecodeException e) {
            throw e;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new DecodeException("Invalid " + what + " payload: " + e.getMessage(), e);
        }
    }
}
