// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import io.dharitri.sdk.core.DharitriDebug;
import io.dharitri.sdk.core.model.TransactionRequest;

class GatewayDebugLoggingTest {

    private static final String SENDER = "drt1qyu5wthldzr8wx5c9ucg8kjagg0jfs53s8nr3zpz3hypefsdd8ssycr6th";

    private HttpServer server;
    private GatewayProxy proxy;
    private final Logger debugLogger = (Logger) LoggerFactory.getLogger("io.dharitri.debug");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/address/" + SENDER,
                exchange -> respond(exchange, 200, "{\"account\":{\"balance\":\"1\",\"nonce\":0}}"));
        server.createContext("/transaction/send", exchange -> respond(exchange, 200,
                "{\"data\":{\"txHash\":\"" + "ab".repeat(32) + "\"},\"code\":\"successful\"}"));
        server.start();
        proxy = GatewayProxy.builder().url("http://127.0.0.1:" + server.getAddress().getPort()).buildProxy();

        appender.start();
        debugLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        DharitriDebug.setEnabled(false);
        debugLogger.detachAndStopAllAppenders();
        proxy.close();
        server.stop(0);
    }

    @Test
    void silentByDefault() {
        proxy.getAccount(SENDER);
        assertTrue(appender.list.isEmpty());
    }

    @Test
    void logsRequestsWhenEnabled() {
        DharitriDebug.enable(DharitriDebug.Channel.REQUEST);

        proxy.getAccount(SENDER);

        String messages = messages();
        assertTrue(messages.contains("[REQUEST] GET /address/" + SENDER), messages);
        assertTrue(messages.contains("status=200"), messages);
        assertFalse(messages.contains("[TX-SEND]"));
    }

    @Test
    void logsTransactionLifecycleWhenEnabled() {
        DharitriDebug.enable(DharitriDebug.Channel.TX);

        proxy.sendTransaction(TransactionRequest.ofJson(SENDER, 3L, "{\"signature\":\"deadbeef\"}"));

        String messages = messages();
        assertTrue(messages.contains("[TX-SEND]"), messages);
        assertTrue(messages.contains("nonce=3"), messages);
        assertTrue(messages.contains("[TX-HASH]"), messages);
        assertFalse(messages.contains("deadbeef"));
        assertFalse(messages.contains("[REQUEST]"));
    }

    private String messages() {
        List<String> lines = appender.list.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .collect(Collectors.toList());
        return String.join("\n", lines);
    }

    private void respond(final HttpExchange exchange, final int statusCode, final String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
