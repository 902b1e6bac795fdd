// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

import io.dharitri.sdk.core.model.TransactionStatusPolicy;

/**
 * Immutable configuration for a gateway proxy.
 *
 * <p>
 * Null components take defaults: V1 API, 30s request timeout, 10s connect
 * timeout, no extra headers, {@link RetryPolicy#defaults()} for in-place
 * retries, {@link RetryPolicy#pollingDefaults()} for transaction polling and
 * {@link TransactionStatusPolicy#defaults()} for status strings.
 *
 * @param baseUrl        gateway base URL, without trailing slash
 * @param apiVersion     endpoint table to use
 * @param requestTimeout per-request timeout
 * @param connectTimeout connection establishment timeout
 * @param headers        extra headers sent with every request
 * @param retryPolicy    in-place retry schedule for idempotent calls
 * @param pollPolicy     schedule for {@code awaitCompletion}
 * @param simulator      whether the target is a chain simulator
 * @param statusPolicy   mapping of node status strings to kinds
 * @since 0.1.0
 */
public record GatewayConfig(
        String baseUrl,
        ApiVersion apiVersion,
        Duration requestTimeout,
        Duration connectTimeout,
        Map<String, String> headers,
        RetryPolicy retryPolicy,
        RetryPolicy pollPolicy,
        boolean simulator,
        TransactionStatusPolicy statusPolicy) {

    public static final String PREFIX = "dharitri.gateway.";
    public static final String KEY_URL = PREFIX + "url";
    public static final String KEY_API_VERSION = PREFIX + "api-version";
    public static final String KEY_TIMEOUT_MS = PREFIX + "timeout-ms";
    public static final String KEY_CONNECT_TIMEOUT_MS = PREFIX + "connect-timeout-ms";
    public static final String KEY_RETRY_MAX_ATTEMPTS = PREFIX + "retry.max-attempts";
    public static final String KEY_RETRY_BASE_DELAY_MS = PREFIX + "retry.base-delay-ms";
    public static final String KEY_RETRY_MULTIPLIER = PREFIX + "retry.multiplier";
    public static final String KEY_RETRY_JITTER = PREFIX + "retry.jitter";
    public static final String KEY_SIMULATOR = PREFIX + "simulator";

    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public GatewayConfig {
        baseUrl = normalizeUrl(baseUrl);
        apiVersion = apiVersion == null ? ApiVersion.V1 : apiVersion;
        requestTimeout = positive(requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout, "requestTimeout");
        connectTimeout = positive(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout, "connectTimeout");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
        pollPolicy = pollPolicy == null ? RetryPolicy.pollingDefaults() : pollPolicy;
        statusPolicy = statusPolicy == null ? TransactionStatusPolicy.defaults() : statusPolicy;
    }

    public static GatewayConfig withDefaults(final String baseUrl) {
        return new GatewayConfig(baseUrl, null, null, null, null, null, null, false, null);
    }

    /**
     * Reads a configuration from {@code dharitri.gateway.*} properties.
     *
     * <p>
     * Only {@value #KEY_URL} is required. Retry keys adjust
     * {@link RetryPolicy#defaults()}; absent keys keep the defaults.
     *
     * @param props the properties
     * @return the configuration
     * @throws IllegalArgumentException if the URL is missing or a value does not parse
     */
    public static GatewayConfig fromProperties(final Properties props) {
        Objects.requireNonNull(props, "props");
        final String url = props.getProperty(KEY_URL);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Missing required property " + KEY_URL);
        }
        final String version = props.getProperty(KEY_API_VERSION);

        final RetryPolicy.Builder retry = RetryPolicy.defaults().toBuilder();
        final String maxAttempts = props.getProperty(KEY_RETRY_MAX_ATTEMPTS);
        if (maxAttempts != null) {
            retry.maxAttempts(parseInt(KEY_RETRY_MAX_ATTEMPTS, maxAttempts));
        }
        final String baseDelay = props.getProperty(KEY_RETRY_BASE_DELAY_MS);
        if (baseDelay != null) {
            retry.baseDelay(Duration.ofMillis(parseLong(KEY_RETRY_BASE_DELAY_MS, baseDelay)));
        }
        final String multiplier = props.getProperty(KEY_RETRY_MULTIPLIER);
        if (multiplier != null) {
            retry.multiplier(parseDouble(KEY_RETRY_MULTIPLIER, multiplier));
        }
        final String jitter = props.getProperty(KEY_RETRY_JITTER);
        if (jitter != null) {
            retry.jitter(parseDouble(KEY_RETRY_JITTER, jitter));
        }

        final String timeout = props.getProperty(KEY_TIMEOUT_MS);
        final String connectTimeout = props.getProperty(KEY_CONNECT_TIMEOUT_MS);
        final RetryPolicy retryPolicy;
        try {
            retryPolicy = retry.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid retry properties: " + e.getMessage(), e);
        }
        return new GatewayConfig(
                url.trim(),
                version == null ? null : ApiVersion.fromTag(version),
                timeout == null ? null : Duration.ofMillis(parseLong(KEY_TIMEOUT_MS, timeout)),
                connectTimeout == null ? null : Duration.ofMillis(parseLong(KEY_CONNECT_TIMEOUT_MS, connectTimeout)),
                null,
                retryPolicy,
                null,
                parseBoolean(KEY_SIMULATOR, props.getProperty(KEY_SIMULATOR, "false")),
                null);
    }

    /** Resolves an endpoint path against the base URL. */
    URI resolve(final Endpoint endpoint) {
        return URI.create(baseUrl + endpoint.path());
    }

    private static String normalizeUrl(final String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        String url = baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid gateway URL: " + baseUrl, e);
        }
        final String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Gateway URL must be http or https: " + baseUrl);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Gateway URL has no host: " + baseUrl);
        }
        return url;
    }

    private static Duration positive(final Duration value, final String name) {
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + value);
        }
        return value;
    }

    private static long parseLong(final String key, final String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
        }
    }

    private static int parseInt(final String key, final String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an int: " + value, e);
        }
    }

    private static double parseDouble(final String key, final String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + value, e);
        }
    }

    private static boolean parseBoolean(final String key, final String value) {
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        throw new IllegalArgumentException("Property " + key + " must be true or false: " + value);
    }
}
