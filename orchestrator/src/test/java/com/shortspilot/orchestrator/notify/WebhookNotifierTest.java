package com.shortspilot.orchestrator.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shortspilot.orchestrator.model.WorkItem;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class WebhookNotifierTest {

    HttpServer              server;
    AtomicReference<String> received = new AtomicReference<>();
    ObjectMapper            mapper   = new ObjectMapper();
    volatile int            status   = 200;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/hook", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void itemFailed_postsEventWithError() throws Exception {
        WorkItem item = new WorkItem("v1", "First", null, 1, Instant.parse("2026-10-19T12:00:00Z"));
        item.fail("FETCH: [PERMANENT] HTTP 404");

        notifier().itemFailed(item);

        JsonNode body = mapper.readTree(received.get());
        assertThat(body.get("event").asText()).isEqualTo("item_failed");
        assertThat(body.get("itemId").asText()).isEqualTo("v1");
        assertThat(body.get("error").asText()).contains("HTTP 404");
    }

    @Test
    void rejectedByWebhook_doesNotThrow() {
        status = 500;

        assertThatCode(() -> notifier().queueDrained()).doesNotThrowAnyException();
        assertThat(received.get()).contains("queue_drained");
    }

    @Test
    void webhookUnreachable_doesNotThrow() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        WebhookNotifier unreachable = new WebhookNotifier("http://127.0.0.1:" + closedPort + "/hook", mapper);

        assertThatCode(unreachable::queueDrained).doesNotThrowAnyException();
    }

    private WebhookNotifier notifier() {
        return new WebhookNotifier("http://127.0.0.1:" + server.getAddress().getPort() + "/hook", mapper);
    }
}
