// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

/**
 * Gateway API revision, selecting the path table used by {@link EndpointCatalog}.
 *
 * <ul>
 *   <li>{@link #V1}: original gateway paths, transaction status at {@code /transaction/{hash}/status},
 *       tokens at {@code /dcdt/{identifier}}</li>
 *   <li>{@link #V2}: status via {@code /transaction/{hash}/process-status}, tokens at
 *       {@code /tokens/{identifier}}</li>
 * </ul>
 *
 * @since 0.1.0
 */
public enum ApiVersion {
    V1,
    V2;

    /**
     * Parses a version tag such as {@code "v2"} or {@code "V1"}.
     *
     * @param tag the tag
     * @return the version
     * @throws IllegalArgumentException if the tag names no known version
     */
    public static ApiVersion fromTag(final String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("API version tag cannot be blank");
        }
        for (ApiVersion version : values()) {
            if (version.name().equalsIgnoreCase(tag.trim())) {
                return version;
            }
        }
        throw new IllegalArgumentException("Unknown API version: " + tag);
    }
}
