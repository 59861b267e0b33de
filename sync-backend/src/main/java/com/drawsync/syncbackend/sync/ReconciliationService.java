package com.drawsync.syncbackend.sync;

import com.drawsync.syncbackend.broadcast.BroadcastRouter;
import com.drawsync.syncbackend.oplog.OperationLog;
import com.drawsync.syncbackend.presence.PresenceRegistry;
import com.drawsync.syncbackend.protocol.ServerMessage;
import com.drawsync.syncbackend.session.Session;
import com.drawsync.syncbackend.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Brings a freshly bound session up to date with one full snapshot.
 *
 * <p>Runs inside the engine's serialization point, so no operation can be accepted
 * between composing the snapshot and the session going live. The session therefore never
 * sees an incremental event that its snapshot does not already account for.
 */
@Component
public class ReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final OperationLog operationLog;
    private final PresenceRegistry presence;
    private final BroadcastRouter router;

    public ReconciliationService(OperationLog operationLog, PresenceRegistry presence, BroadcastRouter router) {
        this.operationLog = operationLog;
        this.presence = presence;
        this.router = router;
    }

    public ServerMessage compose(String sessionId) {
        return ServerMessage.snapshot(
                sessionId,
                presence.snapshot(),
                operationLog.snapshot(),
                operationLog.version());
    }

    /**
     * Sends the snapshot to a SYNCING session and moves it to LIVE.
     *
     * @return false if the session refused the snapshot; it is then being reaped
     */
    public boolean synchronize(Session session) {
        if (session.state() != SessionState.SYNCING) {
            throw new IllegalStateException("Cannot reconcile " + session);
        }
        ServerMessage snapshot = compose(session.id());
        if (!router.sendTo(session, snapshot)) {
            log.warn("Snapshot delivery to {} failed", session);
            return false;
        }
        session.markLive();
        log.info("Session {} is live at version {} ({} operations, {} participants)",
                session.id(), snapshot.version(), snapshot.operations().size(), snapshot.participants().size());
        return true;
    }
}
