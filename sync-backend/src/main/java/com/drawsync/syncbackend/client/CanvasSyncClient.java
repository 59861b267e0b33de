package com.drawsync.syncbackend.client;

import com.drawsync.syncbackend.oplog.Operation;
import com.drawsync.syncbackend.oplog.OperationKind;
import com.drawsync.syncbackend.protocol.MessageType;
import com.drawsync.syncbackend.protocol.ServerMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Reconnecting client for the canvas WebSocket.
 *
 * <p>Every (re)connect runs the full handshake and rebuilds the local view from the
 * server snapshot. Operations submitted while offline stay pending and are re-sent once
 * live; the server ignores ids it has already accepted, so re-sending is safe. A failed
 * connection is retried a bounded number of times, after which the client settles in
 * {@link ConnectionState#DISCONNECTED}.
 */
public class CanvasSyncClient {
    private static final Logger log = LoggerFactory.getLogger(CanvasSyncClient.class);
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    /**
     * Opens one transport connection and reports it through the handler's callbacks.
     */
    @FunctionalInterface
    public interface Connector {
        CompletableFuture<WebSocketSession> connect(WebSocketHandler handler);
    }

    private final ClientOptions options;
    private final ClientIdentity identity;
    private final Connector connector;
    private final ObjectMapper objectMapper;
    private final CanvasState canvas = new CanvasState();
    private final List<CanvasListener> listeners = new CopyOnWriteArrayList<>();
    private final WebSocketHandler handler = new Handler();
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(1, r -> {
        Thread t = new Thread(r, "canvas-client");
        t.setDaemon(true);
        return t;
    });

    private volatile ConnectionState connectionState = ConnectionState.IDLE;
    private WebSocketSession session;
    private ScheduledFuture<?> heartbeat;
    private int attempts;

    public CanvasSyncClient(ClientOptions options, ClientIdentity identity, Connector connector, ObjectMapper objectMapper) {
        this.options = options;
        this.identity = identity;
        this.connector = connector;
        this.objectMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static CanvasSyncClient create(ClientOptions options, ClientIdentity identity) {
        StandardWebSocketClient webSocketClient = new StandardWebSocketClient();
        return new CanvasSyncClient(options, identity,
                h -> webSocketClient.execute(h, new WebSocketHttpHeaders(), options.endpoint()),
                new ObjectMapper());
    }

    public void addListener(CanvasListener listener) {
        listeners.add(listener);
    }

    public ConnectionState connectionState() {
        return connectionState;
    }

    public CanvasState canvas() {
        return canvas;
    }

    /**
     * Starts connecting. A closed client cannot be reused.
     *
     * @throws IllegalStateException if {@link #close()} was called
     */
    public synchronized void connect() {
        switch (connectionState) {
            case CLOSED:
                throw new IllegalStateException("Client is closed");
            case CONNECTING:
            case SYNCING:
            case LIVE:
            case RECONNECTING:
                return;
            default:
                attempts = 0;
                transition(ConnectionState.CONNECTING);
                attempt();
        }
    }

    /**
     * Renders optimistically and sends when live.
     */
    public Operation submitOperation(OperationKind kind, Map<String, Object> payload) {
        Operation operation = Operation.submitted(UUID.randomUUID().toString(), kind, identity.participantId(), payload);
        canvas.addPending(operation);
        if (connectionState == ConnectionState.LIVE) {
            sendOperation(operation);
        }
        return operation;
    }

    /**
     * Cursor positions are ephemeral and dropped while not live.
     */
    public boolean submitCursor(double x, double y) {
        if (connectionState != ConnectionState.LIVE) {
            return false;
        }
        ObjectNode message = message(MessageType.CURSOR_UPDATE);
        message.put("participantId", identity.participantId());
        message.putObject("point").put("x", x).put("y", y);
        return send(message);
    }

    public boolean clear() {
        if (connectionState != ConnectionState.LIVE) {
            return false;
        }
        ObjectNode message = message(MessageType.CLEAR);
        message.put("id", UUID.randomUUID().toString());
        return send(message);
    }

    public synchronized void close() {
        if (connectionState == ConnectionState.CLOSED) {
            return;
        }
        transition(ConnectionState.CLOSED);
        stopHeartbeat();
        WebSocketSession current = session;
        session = null;
        if (current != null && current.isOpen()) {
            sendTo(current, message(MessageType.LEAVE));
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.warn("Error closing canvas connection: {}", e.getMessage());
            }
        }
        scheduler.shutdownNow();
    }

    private synchronized void attempt() {
        if (connectionState == ConnectionState.CLOSED) {
            return;
        }
        attempts++;
        log.info("Connecting to {} (attempt {}/{})", options.endpoint(), attempts, options.maxAttempts());
        CompletableFuture<WebSocketSession> future;
        try {
            future = connector.connect(handler);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((opened, error) -> {
            if (error != null) {
                onAttemptFailed(error);
            }
        });
    }

    private synchronized void onAttemptFailed(Throwable error) {
        if (connectionState == ConnectionState.CLOSED) {
            return;
        }
        log.warn("Connection attempt {}/{} failed: {}", attempts, options.maxAttempts(), error.getMessage());
        if (attempts >= options.maxAttempts()) {
            log.error("Giving up on {} after {} attempts", options.endpoint(), attempts);
            transition(ConnectionState.DISCONNECTED);
            return;
        }
        scheduleRetry();
    }

    private void scheduleRetry() {
        transition(ConnectionState.RECONNECTING);
        try {
            scheduler.schedule(this::attempt, options.retryDelay().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.error("Cannot schedule a reconnect to {}: {}", options.endpoint(), e.getMessage());
            transition(ConnectionState.DISCONNECTED);
        }
    }

    private synchronized void onConnected(WebSocketSession opened) throws IOException {
        if (connectionState == ConnectionState.CLOSED) {
            opened.close(CloseStatus.GOING_AWAY);
            return;
        }
        session = new ConcurrentWebSocketSessionDecorator(opened, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        attempts = 0;
        transition(ConnectionState.SYNCING);

        ObjectNode handshake = message(MessageType.HANDSHAKE);
        handshake.put("participantId", identity.participantId());
        handshake.put("displayName", identity.displayName());
        handshake.put("color", identity.color());
        if (identity.token() != null) {
            handshake.put("token", identity.token());
        }
        send(handshake);
    }

    private synchronized void onConnectionLost(WebSocketSession closed, CloseStatus status) {
        if (session == null || !session.getId().equals(closed.getId())) {
            return;
        }
        session = null;
        stopHeartbeat();
        if (connectionState == ConnectionState.CLOSED || connectionState == ConnectionState.DISCONNECTED) {
            return;
        }
        if (status.getCode() == CloseStatus.POLICY_VIOLATION.getCode()) {
            log.error("Server rejected our identity: {}", status.getReason());
            listeners.forEach(l -> l.onError("Identity rejected: " + status.getReason()));
            transition(ConnectionState.DISCONNECTED);
            return;
        }
        log.warn("Canvas connection lost ({}), reconnecting", status);
        attempts = 0;
        scheduleRetry();
    }

    private void onServerMessage(String payload) {
        ServerMessage message;
        try {
            message = objectMapper.readValue(payload, ServerMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable server message: {}", e.getOriginalMessage());
            return;
        }
        MessageType type = MessageType.fromWire(message.type()).orElse(null);
        if (type == null) {
            log.debug("Ignoring server message of type {}", message.type());
            return;
        }
        switch (type) {
            case SNAPSHOT:
                onSnapshot(message);
                break;
            case OPERATION:
                if (canvas.applyOperation(message.operation(), message.version())) {
                    listeners.forEach(l -> l.onOperation(message.operation()));
                }
                resyncIfStale();
                break;
            case CLEAR:
                canvas.applyClear(message.version());
                listeners.forEach(l -> l.onClear(message.operationId(), message.participantId()));
                resyncIfStale();
                break;
            case CURSOR_UPDATE:
                canvas.cursor(message.participantId(), message.point());
                listeners.forEach(l -> l.onCursor(message.participantId(), message.point()));
                break;
            case PRESENCE_JOIN:
                canvas.presenceJoin(message.participant(), System.currentTimeMillis());
                listeners.forEach(l -> l.onPresenceJoin(message.participant()));
                break;
            case PRESENCE_LEAVE:
                canvas.presenceLeave(message.participantId());
                listeners.forEach(l -> l.onPresenceLeave(message.participantId()));
                break;
            case PRESENCE_UPDATE:
                boolean active = Boolean.TRUE.equals(message.active());
                canvas.presenceUpdate(message.participantId(), active);
                listeners.forEach(l -> l.onPresenceUpdate(message.participantId(), active));
                break;
            case ERROR:
                log.warn("Server rejected a message: {}", message.message());
                listeners.forEach(l -> l.onError(message.message()));
                break;
            default:
                log.debug("Ignoring server message of type {}", message.type());
        }
    }

    private synchronized void onSnapshot(ServerMessage snapshot) {
        canvas.applySnapshot(snapshot.operations(), snapshot.participants(), snapshot.version());
        transition(ConnectionState.LIVE);
        startHeartbeat();
        List<Operation> unconfirmed = canvas.pendingOperations();
        if (!unconfirmed.isEmpty()) {
            log.info("Re-sending {} unconfirmed operation(s)", unconfirmed.size());
            unconfirmed.forEach(this::sendOperation);
        }
        listeners.forEach(l -> l.onSnapshot(canvas));
    }

    private synchronized void resyncIfStale() {
        if (!canvas.isStale() || session == null) {
            return;
        }
        log.warn("Missed updates detected at version {}, resynchronizing", canvas.version());
        try {
            session.close(CloseStatus.NORMAL.withReason("Resync"));
        } catch (IOException e) {
            log.warn("Error closing connection for resync: {}", e.getMessage());
        }
    }

    private void sendOperation(Operation operation) {
        ObjectNode message = message(MessageType.OPERATION);
        ObjectNode body = message.putObject("operation");
        body.put("id", operation.id());
        body.put("kind", operation.kind().wireName());
        body.put("authorId", operation.authorId());
        body.set("payload", objectMapper.valueToTree(operation.payload()));
        send(message);
    }

    private void startHeartbeat() {
        stopHeartbeat();
        long intervalMs = options.heartbeatInterval().toMillis();
        heartbeat = scheduler.scheduleAtFixedRate(() -> {
            ObjectNode beat = message(MessageType.HEARTBEAT);
            beat.put("participantId", identity.participantId());
            send(beat);
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.cancel(false);
            heartbeat = null;
        }
    }

    private ObjectNode message(MessageType type) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", type.wireName());
        return node;
    }

    private boolean send(ObjectNode message) {
        WebSocketSession current;
        synchronized (this) {
            current = session;
        }
        return current != null && sendTo(current, message);
    }

    private boolean sendTo(WebSocketSession target, ObjectNode message) {
        if (!target.isOpen()) {
            return false;
        }
        try {
            target.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
            return true;
        } catch (IOException e) {
            log.warn("Failed to send {}: {}", message.get("type").asText(), e.getMessage());
            return false;
        }
    }

    private void transition(ConnectionState next) {
        if (connectionState == next) {
            return;
        }
        log.debug("Canvas client {} -> {}", connectionState, next);
        connectionState = next;
        listeners.forEach(l -> l.onStateChange(next));
    }

    private class Handler extends TextWebSocketHandler {
        @Override
        public void afterConnectionEstablished(WebSocketSession opened) throws Exception {
            onConnected(opened);
        }

        @Override
        protected void handleTextMessage(WebSocketSession from, TextMessage message) {
            onServerMessage(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession failed, Throwable exception) {
            log.warn("Canvas transport error: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession closed, CloseStatus status) {
            onConnectionLost(closed, status);
        }
    }
}
