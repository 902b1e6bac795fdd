// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.dharitri.sdk.core.error.ApiException;

/**
 * Maps logical {@link Operation}s to HTTP method and path for one {@link ApiVersion}.
 *
 * <p>
 * Resolution is pure: no I/O, no shared mutable state. Templates use
 * {@code {name}} placeholders that are filled from the parameter map and
 * URL-encoded. Resolution fails with a {@code FATAL} {@link ApiException} when
 * <ul>
 * <li>the version table has no entry for the operation,</li>
 * <li>a placeholder has no parameter, or</li>
 * <li>the operation is simulator-only and this catalog was not built for a simulator.</li>
 * </ul>
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * EndpointCatalog catalog = EndpointCatalog.forVersion(ApiVersion.V1);
 * Endpoint endpoint = catalog.resolve(Operation.GET_ACCOUNT, Map.of("address", "drt1..."));
 * // GET /address/drt1...
 * }</pre>
 *
 * @since 0.1.0
 */
public final class EndpointCatalog {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z]+)}");

    private static final Map<ApiVersion, Map<Operation, Template>> TABLES = buildTables();

    private final ApiVersion version;
    private final boolean simulatorEnabled;

    public EndpointCatalog(final ApiVersion version, final boolean simulatorEnabled) {
        this.version = Objects.requireNonNull(version, "version");
        this.simulatorEnabled = simulatorEnabled;
    }

    /**
     * Returns a production catalog, which refuses simulator-only operations.
     *
     * @param version the API version
     * @return the catalog
     */
    public static EndpointCatalog forVersion(final ApiVersion version) {
        return new EndpointCatalog(version, false);
    }

    public ApiVersion version() {
        return version;
    }

    public boolean isSimulatorEnabled() {
        return simulatorEnabled;
    }

    /**
     * Resolves an operation to a concrete endpoint.
     *
     * @param operation the operation
     * @param params    placeholder values
     * @return the endpoint
     * @throws ApiException with kind {@code FATAL} if the operation cannot be resolved
     */
    public Endpoint resolve(final Operation operation, final Map<String, String> params) {
        Objects.requireNonNull(operation, "operation");
        if (operation.isSimulatorOnly() && !simulatorEnabled) {
            throw ApiException.fatal(
                    "Operation " + operation + " is only available against a chain simulator");
        }
        final Template template = TABLES.get(version).get(operation);
        if (template == null) {
            throw ApiException.fatal("Operation " + operation + " is not supported by API " + version);
        }
        return new Endpoint(operation, template.method(), expand(operation, template.path(), params));
    }

    /**
     * Resolves an operation given by name, e.g. {@code "GET_ACCOUNT"} or {@code "get-account"}.
     *
     * @param operationName the operation name
     * @param params        placeholder values
     * @return the endpoint
     * @throws ApiException with kind {@code FATAL} if the name matches no operation
     */
    public Endpoint resolve(final String operationName, final Map<String, String> params) {
        if (operationName == null || operationName.isBlank()) {
            throw ApiException.fatal("Operation name cannot be blank");
        }
        final String normalized = operationName.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        final Operation operation;
        try {
            operation = Operation.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw ApiException.fatal("Unknown operation: " + operationName);
        }
        return resolve(operation, params);
    }

    public boolean supports(final Operation operation) {
        return TABLES.get(version).containsKey(operation)
                && (!operation.isSimulatorOnly() || simulatorEnabled);
    }

    private static String expand(final Operation operation, final String template, final Map<String, String> params) {
        final Map<String, String> values = params == null ? Map.of() : params;
        final Matcher matcher = PLACEHOLDER.matcher(template);
        final StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            final String name = matcher.group(1);
            final String value = values.get(name);
            if (value == null || value.isBlank()) {
                throw ApiException.fatal("Missing parameter '" + name + "' for operation " + operation);
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(encode(value)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String encode(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static Map<ApiVersion, Map<Operation, Template>> buildTables() {
        final Map<Operation, Template> v1 = new EnumMap<>(Operation.class);
        v1.put(Operation.GET_NETWORK_CONFIG, Template.get("/network/config"));
        v1.put(Operation.GET_NETWORK_ECONOMICS, Template.get("/network/economics"));
        v1.put(Operation.GET_NETWORK_STATUS, Template.get("/network/status/{shard}"));
        v1.put(Operation.GET_ACCOUNT, Template.get("/address/{address}"));
        v1.put(Operation.SEND_TRANSACTION, Template.post("/transaction/send"));
        v1.put(Operation.GET_TRANSACTION, Template.get("/transaction/{hash}?withResults={withResults}"));
        v1.put(Operation.GET_TRANSACTION_STATUS, Template.get("/transaction/{hash}/status"));
        v1.put(Operation.GET_TOKEN, Template.get("/dcdt/{identifier}"));
        v1.put(Operation.GET_HYPER_BLOCK_BY_NONCE, Template.get("/hyperblock/by-nonce/{nonce}"));
        v1.put(Operation.GET_HYPER_BLOCK_BY_HASH, Template.get("/hyperblock/by-hash/{hash}"));
        v1.put(Operation.SIMULATOR_GENERATE_BLOCKS, Template.post("/simulator/generate-blocks/{count}"));
        v1.put(Operation.SIMULATOR_GENERATE_BLOCKS_UNTIL_TX_PROCESSED,
                Template.post("/simulator/generate-blocks-until-transaction-processed/{hash}"));
        v1.put(Operation.SIMULATOR_GENERATE_BLOCKS_UNTIL_EPOCH,
                Template.post("/simulator/generate-blocks-until-epoch-reached/{epoch}"));

        final Map<Operation, Template> v2 = new EnumMap<>(v1);
        v2.put(Operation.GET_TRANSACTION_STATUS, Template.get("/transaction/{hash}/process-status"));
        v2.put(Operation.GET_TOKEN, Template.get("/tokens/{identifier}"));

        final Map<ApiVersion, Map<Operation, Template>> tables = new EnumMap<>(ApiVersion.class);
        tables.put(ApiVersion.V1, Collections.unmodifiableMap(v1));
        tables.put(ApiVersion.V2, Collections.unmodifiableMap(v2));
        return Collections.unmodifiableMap(tables);
    }

    private record Template(HttpMethod method, String path) {
        static Template get(final String path) {
            return new Template(HttpMethod.GET, path);
        }

        static Template post(final String path) {
            return new Template(HttpMethod.POST, path);
        }
    }
}
