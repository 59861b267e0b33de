package com.drawsync.syncbackend.session;

import com.drawsync.syncbackend.broadcast.BroadcastRouter;
import com.drawsync.syncbackend.presence.Participant;
import com.drawsync.syncbackend.presence.PresenceChange;
import com.drawsync.syncbackend.presence.PresenceRegistry;
import com.drawsync.syncbackend.protocol.HandshakeMessage;
import com.drawsync.syncbackend.protocol.ProtocolException;
import com.drawsync.syncbackend.protocol.ServerMessage;
import com.drawsync.syncbackend.security.HandshakeVerifier;
import com.drawsync.syncbackend.sync.ReconciliationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * Binds transport connections to participants.
 *
 * <p>Not thread-safe on its own: every call is made from inside
 * {@link com.drawsync.syncbackend.sync.CanvasSyncEngine}, which serializes them.
 */
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
    static final String BLOCKING_SEND_TIMEOUT = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final SessionRegistry sessions;
    private final PresenceRegistry presence;
    private final BroadcastRouter router;
    private final ReconciliationService reconciliation;
    private final HandshakeVerifier verifier;
    private final SessionReaper reaper;
    private final Executor outbound;
    private final long sendTimeLimitMs;
    private final int sendBufferSizeLimit;

    public SessionManager(SessionRegistry sessions,
                          PresenceRegistry presence,
                          BroadcastRouter router,
                          ReconciliationService reconciliation,
                          HandshakeVerifier verifier,
                          SessionReaper reaper,
                          Executor outbound,
                          Duration sendTimeLimit,
                          int sendBufferSizeLimit) {
        this.sessions = sessions;
        this.presence = presence;
        this.router = router;
        this.reconciliation = reconciliation;
        this.verifier = verifier;
        this.reaper = reaper;
        this.outbound = outbound;
        this.sendTimeLimitMs = sendTimeLimit.toMillis();
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    /**
     * Registers a new, unauthenticated session for the transport.
     */
    public String onConnect(WebSocketSession transport) {
        limitBlockingSends(transport);
        Session session = new Session(transport, outbound, sendBufferSizeLimit,
                failed -> reaper.reap(failed, SessionReaper.SEND_FAILED));
        sessions.register(session);
        log.info("Session {} connected, total_sessions={}", session.id(), sessions.size());
        return session.id();
    }

    /**
     * Binds the session to the asserted identity, delivers the snapshot and announces the
     * participant to everybody else.
     *
     * @throws com.drawsync.syncbackend.protocol.IdentityException if the identity is rejected
     * @throws ProtocolException if the session is unknown or already bound
     */
    public Participant handshake(String sessionId, HandshakeMessage message) {
        Session session = sessions.find(sessionId)
                .orElseThrow(() -> new ProtocolException("Unknown session " + sessionId));
        if (session.state() != SessionState.UNAUTHENTICATED) {
            throw new ProtocolException("Session is already bound to " + session.participantId());
        }
        Participant participant = verifier.verify(message);

        session.bind(participant);
        PresenceChange change = presence.attach(participant, sessionId);
        log.info("Handshake: session {} is participant {} ({})", sessionId, participant.id(), change);

        if (!reconciliation.synchronize(session)) {
            presence.detach(participant.id(), sessionId);
            return participant;
        }

        if (change == PresenceChange.JOINED) {
            router.publish(ServerMessage.presenceJoin(participant), sessionId);
        } else if (change == PresenceChange.REACTIVATED) {
            router.publish(ServerMessage.presenceUpdate(participant.id(), true), sessionId);
        }
        return participant;
    }

    /**
     * Tears the session down. Safe to call more than once.
     */
    public void onDisconnect(String sessionId) {
        Session session = sessions.remove(sessionId);
        if (session == null) {
            return;
        }
        session.markClosed();
        String participantId = session.participantId();
        log.info("Session {} disconnected (participant={}), remaining_sessions={}",
                sessionId, participantId, sessions.size());
        if (participantId != null && presence.detach(participantId, sessionId)) {
            router.publish(ServerMessage.presenceLeave(participantId));
        }
    }

    /**
     * @throws ProtocolException unless the session exists and has finished reconciliation
     */
    public Session requireLive(String sessionId) {
        Session session = sessions.find(sessionId)
                .orElseThrow(() -> new ProtocolException("Unknown session " + sessionId));
        if (!session.isLive()) {
            throw new ProtocolException("Session is " + session.state() + "; complete the handshake first");
        }
        return session;
    }

    /**
     * Bounds how long the outbound drain of a stalled peer may block on Tomcat.
     */
    private void limitBlockingSends(WebSocketSession transport) {
        if (transport instanceof NativeWebSocketSession nativeSession) {
            jakarta.websocket.Session container = nativeSession.getNativeSession(jakarta.websocket.Session.class);
            if (container != null) {
                container.getUserProperties().put(BLOCKING_SEND_TIMEOUT, sendTimeLimitMs);
            }
        }
    }

    public void shutdown() {
        if (outbound instanceof ExecutorService service) {
            service.shutdownNow();
        }
    }
}
