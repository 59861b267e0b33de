package com.drawsync.syncbackend.session;

import com.drawsync.syncbackend.presence.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runtime state of one transport connection. Owns the transport: the rest of the server
 * sends and closes through this class and never inspects the socket itself.
 *
 * <p>Outbound frames go through a per-session queue drained on the outbound executor, so
 * a peer that stops reading only stalls its own queue. Frames leave in the order they
 * were queued. A queue whose backlog exceeds the buffer limit refuses further frames.
 */
public class Session {
    private static final Logger log = LoggerFactory.getLogger(Session.class);
    private static final ByteBuffer PING_PAYLOAD = ByteBuffer.wrap(new byte[]{'p', 'i', 'n', 'g'});

    private final String id;
    private final WebSocketSession transport;
    private final Executor outbound;
    private final int bufferSizeLimit;
    private final Consumer<Session> onSendFailure;
    private final Queue<WebSocketMessage<?>> queue = new ConcurrentLinkedQueue<>();
    private final AtomicLong queuedBytes = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();
    private volatile SessionState state = SessionState.UNAUTHENTICATED;
    private volatile Participant participant;
    private volatile boolean transportConfirmed = true;

    public Session(WebSocketSession transport,
                   Executor outbound,
                   int bufferSizeLimit,
                   Consumer<Session> onSendFailure) {
        this.id = transport.getId();
        this.transport = transport;
        this.outbound = outbound;
        this.bufferSizeLimit = bufferSizeLimit;
        this.onSendFailure = onSendFailure;
    }

    public String id() {
        return id;
    }

    public SessionState state() {
        return state;
    }

    public Participant participant() {
        return participant;
    }

    public String participantId() {
        Participant bound = participant;
        return bound != null ? bound.id() : null;
    }

    public boolean isLive() {
        return state == SessionState.LIVE;
    }

    void bind(Participant participant) {
        if (state != SessionState.UNAUTHENTICATED) {
            throw new IllegalStateException("Session " + id + " is already " + state);
        }
        this.participant = participant;
        this.state = SessionState.SYNCING;
    }

    /**
     * Completes reconciliation. Only valid right after the snapshot was queued.
     */
    public void markLive() {
        if (state != SessionState.SYNCING) {
            throw new IllegalStateException("Session " + id + " cannot go live from " + state);
        }
        state = SessionState.LIVE;
    }

    void markClosed() {
        state = SessionState.CLOSED;
    }

    /**
     * Any inbound frame, pong included, proves the transport is alive.
     */
    public void recordTraffic() {
        transportConfirmed = true;
    }

    /**
     * Starts a new liveness round.
     *
     * @return whether the transport had confirmed itself since the previous round
     */
    public boolean resetTransportConfirmation() {
        boolean confirmed = transportConfirmed;
        transportConfirmed = false;
        return confirmed;
    }

    /**
     * Queues a frame without waiting for the peer.
     *
     * @return false if the session is closed, has failed, or its backlog is over the limit
     */
    public boolean send(TextMessage frame) {
        return enqueue(frame);
    }

    public boolean ping() {
        return enqueue(new PingMessage(PING_PAYLOAD.duplicate()));
    }

    private boolean enqueue(WebSocketMessage<?> frame) {
        if (state == SessionState.CLOSED || failed.get() || !transport.isOpen()) {
            return false;
        }
        long backlog = queuedBytes.get();
        if (backlog > bufferSizeLimit) {
            log.warn("Session {} has {} bytes queued, refusing more", id, backlog);
            return false;
        }
        queuedBytes.addAndGet(frame.getPayloadLength());
        queue.add(frame);
        scheduleDrain();
        return true;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            outbound.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            fail("outbound executor rejected the session");
        }
    }

    private void drain() {
        try {
            WebSocketMessage<?> frame;
            while ((frame = queue.poll()) != null) {
                queuedBytes.addAndGet(-frame.getPayloadLength());
                if (failed.get()) {
                    continue;
                }
                try {
                    transport.sendMessage(frame);
                } catch (IOException | IllegalStateException e) {
                    fail(e.getMessage());
                }
            }
        } finally {
            draining.set(false);
        }
        if (!queue.isEmpty() && !failed.get()) {
            scheduleDrain();
        }
    }

    private void fail(String reason) {
        if (!failed.compareAndSet(false, true)) {
            return;
        }
        queue.clear();
        queuedBytes.set(0);
        log.warn("Send to session {} failed: {}", id, reason);
        onSendFailure.accept(this);
    }

    public void close(CloseStatus status) {
        if (!transport.isOpen()) {
            return;
        }
        try {
            transport.close(status);
        } catch (IOException e) {
            log.warn("Error closing session {}: {}", id, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "Session[" + id + ", " + state + (participant != null ? ", " + participant.id() : "") + "]";
    }
}
