// SPDX-License-Identifier: MIT OR Apache-2.0
package io.dharitri.sdk.http;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import io.dharitri.sdk.core.error.ApiErrorKind;
import io.dharitri.sdk.core.error.ApiException;
import io.dharitri.sdk.core.model.TransactionOnNetwork;
import io.dharitri.sdk.core.model.TransactionRequest;
import io.dharitri.sdk.core.model.TransactionStatus;
import io.dharitri.sdk.core.types.TxHash;

/**
 * {@link DefaultChainSimulator} against a fake simulator whose blocks advance only on request.
 */
class DefaultChainSimulatorTest {

    private static final String SENDER = "drt1qyu5wthldzr8wx5c9ucg8kjagg0jfs53s8nr3zpz3hypefsdd8ssycr6th";
    private static final TxHash HASH = new TxHash("9a".repeat(32));

    private HttpServer server;
    private ChainSimulator simulator;
    private final AtomicInteger blocks = new AtomicInteger();
    private final List<String> controlCalls = new CopyOnWriteArrayList<>();
    private volatile int includedAtBlock = Integer.MAX_VALUE;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/transaction/send", exchange -> {
            includedAtBlock = blocks.get() + 1;
            respond(exchange, 200, "{\"data\":{\"txHash\":\"" + HASH.value() + "\"},\"code\":\"successful\"}");
        });
        server.createContext("/transaction/" + HASH.value(), exchange -> {
            final String status = blocks.get() >= includedAtBlock ? "success" : "pending";
            respond(exchange, 200, "{\"data\":{\"transaction\":{\"sender\":\"" + SENDER + "\",\"receiver\":\"drt1r\","
                    + "\"nonce\":1,\"value\":\"0\",\"status\":\"" + status + "\"}},\"code\":\"successful\"}");
        });
        server.createContext("/simulator/", exchange -> {
            controlCalls.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
            final String path = exchange.getRequestURI().getPath();
            if (path.startsWith("/simulator/generate-blocks/")) {
                blocks.addAndGet(Integer.parseInt(path.substring(path.lastIndexOf('/') + 1)));
            } else {
                blocks.incrementAndGet();
            }
            respond(exchange, 200, "{\"data\":{},\"error\":\"\",\"code\":\"successful\"}");
        });
        server.start();

        simulator = GatewayProxy.builder()
                .url("http://127.0.0.1:" + server.getAddress().getPort())
                .simulator(true)
                // a live-network schedule would sleep for seconds
                .pollPolicy(RetryPolicy.builder()
                        .maxAttempts(10)
                        .baseDelay(Duration.ofSeconds(5))
                        .maxDelay(Duration.ofSeconds(5))
                        .build())
                .buildSimulator();
    }

    @AfterEach
    void tearDown() {
        simulator.close();
        server.stop(0);
    }

    @Test
    void sendGenerateThenGetIsTerminal() {
        TxHash hash = simulator.sendTransaction(TransactionRequest.ofJson(SENDER, 1L, "{}"));
        simulator.generateBlocks(1);
        TransactionOnNetwork tx = simulator.getTransaction(hash);

        assertEquals(HASH, hash);
        assertTrue(tx.status().isTerminal());
        assertEquals(TransactionStatus.Kind.SUCCESS, tx.status().kind());
        assertEquals(List.of("POST /simulator/generate-blocks/1"), controlCalls);
    }

    @Test
    void sendAndGenerateProducesRequestedBlocks() {
        TxHash hash = simulator.sendTransactionAndGenerate(TransactionRequest.ofJson(SENDER, 1L, "{}"), 3);

        assertEquals(3, blocks.get());
        assertTrue(simulator.getTransaction(hash).status().isSuccessful());
    }

    @Test
    void awaitCompletionGeneratesBlocksInsteadOfSleeping() {
        simulator.sendTransaction(TransactionRequest.ofJson(SENDER, 1L, "{}"));

        long start = System.nanoTime();
        PollResult result = simulator.awaitCompletion(HASH);
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000L;

        assertEquals(PollResult.State.SUCCEEDED, result.state());
        assertEquals(2, result.attempts());
        assertEquals(1, blocks.get());
        assertTrue(elapsedMillis < 4_000, "simulator polling should not sleep, took " + elapsedMillis + "ms");
    }

    @Test
    void controlEndpoints() {
        simulator.generateBlocksUntilEpochReached(4);
        simulator.generateBlocksUntilTransactionProcessed(HASH);

        assertEquals(List.of(
                "POST /simulator/generate-blocks-until-epoch-reached/4",
                "POST /simulator/generate-blocks-until-transaction-processed/" + HASH.value()), controlCalls);
    }

    @Test
    void invalidBlockCountsAreFatal() {
        assertEquals(ApiErrorKind.FATAL, assertThrows(ApiException.class, () -> simulator.generateBlocks(0)).kind());
        assertEquals(ApiErrorKind.FATAL, assertThrows(ApiException.class,
                () -> simulator.sendTransactionAndGenerate(TransactionRequest.ofJson(SENDER, 1L, "{}"), 0)).kind());
        assertTrue(controlCalls.isEmpty());
    }

    @Test
    void configurationReflectsSimulatorMode() {
        assertTrue(simulator.config().simulator());
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
