package com.drawsync.syncbackend.sync;

import com.drawsync.syncbackend.broadcast.BroadcastRouter;
import com.drawsync.syncbackend.config.CanvasSyncProperties;
import com.drawsync.syncbackend.oplog.AppendResult;
import com.drawsync.syncbackend.oplog.Operation;
import com.drawsync.syncbackend.oplog.OperationLog;
import com.drawsync.syncbackend.presence.PresenceRegistry;
import com.drawsync.syncbackend.protocol.ClearMessage;
import com.drawsync.syncbackend.protocol.ClientMessage;
import com.drawsync.syncbackend.protocol.CursorUpdateMessage;
import com.drawsync.syncbackend.protocol.HandshakeMessage;
import com.drawsync.syncbackend.protocol.HeartbeatMessage;
import com.drawsync.syncbackend.protocol.IdentityException;
import com.drawsync.syncbackend.protocol.MessageCodec;
import com.drawsync.syncbackend.protocol.OperationMessage;
import com.drawsync.syncbackend.protocol.ProtocolException;
import com.drawsync.syncbackend.protocol.ServerMessage;
import com.drawsync.syncbackend.protocol.SubmittedOperation;
import com.drawsync.syncbackend.session.Session;
import com.drawsync.syncbackend.session.SessionManager;
import com.drawsync.syncbackend.session.SessionRegistry;
import com.drawsync.syncbackend.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * The authority: every inbound event passes through here, one at a time.
 *
 * <p>All entry points are synchronized on the engine, which makes the operation log,
 * the presence registry and the order of broadcasts consistent with each other without
 * any further locking. Socket writes and persistence leave this thread and are never
 * waited for.
 */
@Component
public class CanvasSyncEngine {
    private static final Logger log = LoggerFactory.getLogger(CanvasSyncEngine.class);

    private final SessionManager sessionManager;
    private final SessionRegistry sessions;
    private final OperationLog operationLog;
    private final PresenceRegistry presence;
    private final BroadcastRouter router;
    private final ReconciliationService reconciliation;
    private final MessageCodec codec;
    private final Duration presenceTimeout;

    public CanvasSyncEngine(SessionManager sessionManager,
                            SessionRegistry sessions,
                            OperationLog operationLog,
                            PresenceRegistry presence,
                            BroadcastRouter router,
                            ReconciliationService reconciliation,
                            MessageCodec codec,
                            CanvasSyncProperties properties) {
        this.sessionManager = sessionManager;
        this.sessions = sessions;
        this.operationLog = operationLog;
        this.presence = presence;
        this.router = router;
        this.reconciliation = reconciliation;
        this.codec = codec;
        this.presenceTimeout = properties.getLiveness().getPresenceTimeout();
    }

    public synchronized String connect(WebSocketSession transport) {
        return sessionManager.onConnect(transport);
    }

    public synchronized void disconnect(String sessionId) {
        sessionManager.onDisconnect(sessionId);
    }

    public void pong(String sessionId) {
        sessions.find(sessionId).ifPresent(Session::recordTraffic);
    }

    /**
     * Decodes and applies one inbound text frame.
     */
    public synchronized void receive(String sessionId, String payload) {
        Session session = sessions.find(sessionId).orElse(null);
        if (session == null) {
            log.debug("Dropping frame for unknown session {}", sessionId);
            return;
        }
        session.recordTraffic();
        try {
            ClientMessage message = codec.decode(payload);
            log.debug("Session {} sent {}", sessionId, message.type().wireName());
            dispatch(session, message);
        } catch (IdentityException e) {
            log.warn("Handshake rejected for session {}: {}", sessionId, e.getMessage());
            terminate(session, CloseStatus.POLICY_VIOLATION.withReason(e.getMessage()));
        } catch (ProtocolException e) {
            if (session.state() == SessionState.LIVE) {
                log.warn("Rejected message from {}: {}", session, e.getMessage());
                router.sendTo(session, ServerMessage.error(e.getMessage()));
            } else {
                log.warn("Protocol error before handshake on session {}, closing: {}", sessionId, e.getMessage());
                terminate(session, CloseStatus.BAD_DATA.withReason(e.getMessage()));
            }
        }
    }

    private void dispatch(Session session, ClientMessage message) {
        switch (message.type()) {
            case HANDSHAKE:
                sessionManager.handshake(session.id(), (HandshakeMessage) message);
                break;
            case OPERATION:
                submitOperation(session.id(), (OperationMessage) message);
                break;
            case CLEAR:
                clear(session.id(), (ClearMessage) message);
                break;
            case CURSOR_UPDATE:
                submitCursor(session.id(), (CursorUpdateMessage) message);
                break;
            case HEARTBEAT:
                heartbeat(session.id(), (HeartbeatMessage) message);
                break;
            case LEAVE:
                leave(session.id());
                break;
            default:
                throw new ProtocolException("Unsupported message type: " + message.type().wireName());
        }
    }

    public synchronized AppendResult submitOperation(String sessionId, OperationMessage message) {
        Session session = sessionManager.requireLive(sessionId);
        SubmittedOperation submitted = message.operation();
        String author = requireSelf(session, submitted.authorId(), "operation.authorId");

        AppendResult result = operationLog.append(
                Operation.submitted(submitted.id(), submitted.kind(), author, submitted.payload()));
        if (!result.accepted()) {
            return result;
        }
        if (result.operation().isClear()) {
            router.publish(ServerMessage.clear(result.operation().id(), author, result.position()));
        } else {
            router.publish(ServerMessage.operation(result.operation(), result.position()));
        }
        return result;
    }

    public synchronized AppendResult clear(String sessionId, ClearMessage message) {
        Session session = sessionManager.requireLive(sessionId);
        String clearId = message.id() != null && !message.id().isBlank()
                ? message.id()
                : UUID.randomUUID().toString();
        AppendResult result = operationLog.clear(clearId, session.participantId());
        if (result.accepted()) {
            router.publish(ServerMessage.clear(clearId, session.participantId(), result.position()));
        }
        return result;
    }

    public synchronized void submitCursor(String sessionId, CursorUpdateMessage message) {
        Session session = sessionManager.requireLive(sessionId);
        String participantId = requireSelf(session, message.participantId(), "participantId");
        presence.updateCursor(participantId, message.point().toPoint());
        router.publish(ServerMessage.cursorUpdate(participantId, message.point().toPoint()), sessionId);
    }

    public synchronized void heartbeat(String sessionId, HeartbeatMessage message) {
        Session session = sessionManager.requireLive(sessionId);
        String participantId = requireSelf(session, message.participantId(), "participantId");
        if (presence.heartbeat(participantId)) {
            router.publish(ServerMessage.presenceUpdate(participantId, true));
        }
    }

    public synchronized void leave(String sessionId) {
        Session session = sessionManager.requireLive(sessionId);
        log.info("Participant {} left via session {}", session.participantId(), sessionId);
        terminate(session, CloseStatus.NORMAL.withReason("Left"));
    }

    /**
     * Flips participants without a recent application heartbeat to inactive.
     */
    public synchronized List<String> sweepPresence() {
        List<String> expired = presence.expireHeartbeats(presenceTimeout);
        for (String participantId : expired) {
            router.publish(ServerMessage.presenceUpdate(participantId, false));
        }
        return expired;
    }

    public synchronized ServerMessage snapshot() {
        return reconciliation.compose(null);
    }

    private void terminate(Session session, CloseStatus status) {
        session.close(status);
        sessionManager.onDisconnect(session.id());
    }

    private static String requireSelf(Session session, String claimed, String field) {
        String self = session.participantId();
        if (claimed != null && !claimed.isBlank() && !claimed.equals(self)) {
            throw new ProtocolException(field + " '" + claimed + "' does not match the session's participant");
        }
        return self;
    }
}
