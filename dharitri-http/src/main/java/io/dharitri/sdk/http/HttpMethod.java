// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

/**
 * HTTP methods used by the gateway API.
 */
public enum HttpMethod {
    GET,
    POST
}
