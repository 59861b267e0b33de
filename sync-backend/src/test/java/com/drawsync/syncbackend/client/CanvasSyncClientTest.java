package com.drawsync.syncbackend.client;

import com.drawsync.syncbackend.oplog.Operation;
import com.drawsync.syncbackend.oplog.OperationKind;
import com.drawsync.syncbackend.support.RecordingTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CanvasSyncClientTest {

    private static final ClientOptions OPTIONS = new ClientOptions(URI.create("ws://localhost:3001/ws/canvas"),
            3, Duration.ofMillis(10), Duration.ofHours(1));
    private static final ClientIdentity ALICE = new ClientIdentity("alice", "Alice", "#FF6B6B", null);

    private CanvasSyncClient client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    @Test
    void givesUpAfterMaxAttempts() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch disconnected = new CountDownLatch(1);
        client = new CanvasSyncClient(OPTIONS, ALICE, handler -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("Connection refused"));
        }, new ObjectMapper());
        client.addListener(new CanvasListener() {
            @Override
            public void onStateChange(ConnectionState state) {
                if (state == ConnectionState.DISCONNECTED) {
                    disconnected.countDown();
                }
            }
        });

        client.connect();

        assertTrue(disconnected.await(5, TimeUnit.SECONDS));
        assertEquals(3, attempts.get());
        assertEquals(ConnectionState.DISCONNECTED, client.connectionState());
    }

    @Test
    void closedClientCannotBeReconnected() {
        AtomicInteger attempts = new AtomicInteger();
        client = new CanvasSyncClient(OPTIONS, ALICE, handler -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("Connection refused"));
        }, new ObjectMapper());

        client.close();

        assertThrows(IllegalStateException.class, client::connect);
        assertEquals(0, attempts.get());
        assertEquals(ConnectionState.CLOSED, client.connectionState());
    }

    @Test
    void disconnectedClientCanStartOver() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch gaveUpOnce = new CountDownLatch(1);
        CountDownLatch gaveUpTwice = new CountDownLatch(2);
        client = new CanvasSyncClient(OPTIONS, ALICE, handler -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("Connection refused"));
        }, new ObjectMapper());
        client.addListener(new CanvasListener() {
            @Override
            public void onStateChange(ConnectionState state) {
                if (state == ConnectionState.DISCONNECTED) {
                    gaveUpOnce.countDown();
                    gaveUpTwice.countDown();
                }
            }
        });

        client.connect();
        assertTrue(gaveUpOnce.await(5, TimeUnit.SECONDS));
        client.connect();

        assertTrue(gaveUpTwice.await(5, TimeUnit.SECONDS));
        assertEquals(6, attempts.get());
    }

    @Test
    void handshakesOnConnectAndGoesLiveOnSnapshot() throws Exception {
        FakeServer server = new FakeServer("t1");
        client = new CanvasSyncClient(OPTIONS, ALICE, server::accept, new ObjectMapper());

        client.connect();

        JsonNode handshake = server.transport.received().get(0);
        assertEquals("handshake", handshake.get("type").asText());
        assertEquals("alice", handshake.get("participantId").asText());
        assertEquals(ConnectionState.SYNCING, client.connectionState());

        server.send("{\"type\":\"snapshot\",\"sessionId\":\"t1\",\"version\":1,\"participants\":[],"
                + "\"operations\":[{\"id\":\"op1\",\"kind\":\"stroke\",\"authorId\":\"bob\",\"payload\":{},\"createdAt\":1}]}");

        assertEquals(ConnectionState.LIVE, client.connectionState());
        assertThat(client.canvas().operations()).extracting(Operation::id).containsExactly("op1");
    }

    @Test
    void offlineOperationsAreSentOnceLive() throws Exception {
        FakeServer server = new FakeServer("t1");
        client = new CanvasSyncClient(OPTIONS, ALICE, server::accept, new ObjectMapper());

        Operation drawn = client.submitOperation(OperationKind.STROKE, Map.of("tool", "pen"));
        client.connect();
        assertThat(server.transport.received("operation")).isEmpty();

        server.send("{\"type\":\"snapshot\",\"sessionId\":\"t1\",\"version\":0,\"participants\":[],\"operations\":[]}");

        List<JsonNode> sent = server.transport.received("operation");
        assertEquals(1, sent.size());
        assertEquals(drawn.id(), sent.get(0).get("operation").get("id").asText());
        assertEquals("alice", sent.get(0).get("operation").get("authorId").asText());
    }

    @Test
    void echoedOperationIsNotRenderedTwice() throws Exception {
        FakeServer server = new FakeServer("t1");
        List<Operation> rendered = new CopyOnWriteArrayList<>();
        client = new CanvasSyncClient(OPTIONS, ALICE, server::accept, new ObjectMapper());
        client.addListener(new CanvasListener() {
            @Override
            public void onOperation(Operation operation) {
                rendered.add(operation);
            }
        });
        client.connect();
        server.send("{\"type\":\"snapshot\",\"sessionId\":\"t1\",\"version\":0,\"participants\":[],\"operations\":[]}");

        String echo = "{\"type\":\"operation\",\"version\":1,"
                + "\"operation\":{\"id\":\"op1\",\"kind\":\"stroke\",\"authorId\":\"bob\",\"payload\":{},\"createdAt\":1}}";
        server.send(echo);
        server.send(echo);

        assertEquals(1, rendered.size());
        assertEquals(1, client.canvas().version());
    }

    @Test
    void versionGapTriggersResync() throws Exception {
        FakeServer server = new FakeServer("t1");
        client = new CanvasSyncClient(OPTIONS, ALICE, server::accept, new ObjectMapper());
        client.connect();
        server.send("{\"type\":\"snapshot\",\"sessionId\":\"t1\",\"version\":1,\"participants\":[],\"operations\":[]}");

        server.send("{\"type\":\"operation\",\"version\":5,"
                + "\"operation\":{\"id\":\"op5\",\"kind\":\"stroke\",\"authorId\":\"bob\",\"payload\":{},\"createdAt\":5}}");

        assertFalse(server.transport.isOpen());
        assertEquals(CloseStatus.NORMAL.getCode(), server.transport.closeStatus().getCode());
    }

    @Test
    void identityRejectionIsTerminal() throws Exception {
        FakeServer server = new FakeServer("t1");
        client = new CanvasSyncClient(OPTIONS, ALICE, server::accept, new ObjectMapper());
        client.connect();

        server.handler.afterConnectionClosed(server.transport.session(),
                CloseStatus.POLICY_VIOLATION.withReason("A participant token is required"));

        assertEquals(ConnectionState.DISCONNECTED, client.connectionState());
        assertEquals(1, server.connections);
    }

    @Test
    void closeSendsLeave() throws Exception {
        FakeServer server = new FakeServer("t1");
        client = new CanvasSyncClient(OPTIONS, ALICE, server::accept, new ObjectMapper());
        client.connect();
        server.send("{\"type\":\"snapshot\",\"sessionId\":\"t1\",\"version\":0,\"participants\":[],\"operations\":[]}");

        client.close();

        assertEquals(1, server.transport.received("leave").size());
        assertFalse(server.transport.isOpen());
        assertEquals(ConnectionState.CLOSED, client.connectionState());
    }

    private static final class FakeServer {
        private final RecordingTransport transport;
        private WebSocketHandler handler;
        private int connections;

        private FakeServer(String transportId) {
            this.transport = new RecordingTransport(transportId);
        }

        private CompletableFuture<WebSocketSession> accept(WebSocketHandler clientHandler) {
            handler = clientHandler;
            connections++;
            try {
                clientHandler.afterConnectionEstablished(transport.session());
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
            return CompletableFuture.completedFuture(transport.session());
        }

        private void send(String json) throws Exception {
            handler.handleMessage(transport.session(), new TextMessage(json));
        }
    }
}
