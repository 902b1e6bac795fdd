// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http.internal;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import io.dharitri.sdk.core.error.DecodeException;

class GatewayEnvelopeTest {

    @Test
    void unwrapsDataObject() {
        GatewayEnvelope envelope = GatewayEnvelope.parse(
                "{\"data\":{\"account\":{\"nonce\":1}},\"error\":\"\",\"code\":\"successful\"}");
        assertTrue(envelope.data().has("account"));
        assertFalse(envelope.hasError());
        assertEquals("successful", envelope.code());
    }

    @Test
    void bareObjectIsItsOwnPayload() {
        GatewayEnvelope envelope = GatewayEnvelope.parse("{\"account\":{\"balance\":\"100\",\"nonce\":5}}");
        assertTrue(envelope.data().has("account"));
        assertFalse(envelope.hasError());
        assertNull(envelope.code());
    }

    @Test
    void detectsErrors() {
        assertTrue(GatewayEnvelope.parse("{\"data\":null,\"error\":\"boom\",\"code\":\"\"}").hasError());
        assertTrue(GatewayEnvelope.parse("{\"data\":{},\"code\":\"internal_issue\"}").hasError());
        assertFalse(GatewayEnvelope.parse("{\"data\":{},\"code\":\"SUCCESSFUL\"}").hasError());
    }

    @Test
    void rejectsMalformedBodies() {
        assertThrows(DecodeException.class, () -> GatewayEnvelope.parse(""));
        assertThrows(DecodeException.class, () -> GatewayEnvelope.parse("<html/>"));
        assertThrows(DecodeException.class, () -> GatewayEnvelope.parse("\"text\""));
        assertThrows(DecodeException.class, () -> GatewayEnvelope.parse("{\"data\":[1]}"));
        assertThrows(DecodeException.class, () -> GatewayEnvelope.parse("{\"data\":{},\"error\":42}"));
    }
}
