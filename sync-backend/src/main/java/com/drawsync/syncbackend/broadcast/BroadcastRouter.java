package com.drawsync.syncbackend.broadcast;

import com.drawsync.syncbackend.protocol.MessageCodec;
import com.drawsync.syncbackend.protocol.ServerMessage;
import com.drawsync.syncbackend.session.Session;
import com.drawsync.syncbackend.session.SessionReaper;
import com.drawsync.syncbackend.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

/**
 * Fans server messages out to live sessions.
 *
 * <p>Each message is encoded once and queued on every recipient's session; the caller
 * never waits for a socket write. A recipient sees messages in the order {@code publish}
 * was called; nothing is batched or coalesced. A recipient that refuses the frame is
 * handed to the {@link SessionReaper} and the loop carries on with the others.
 */
@Component
public class BroadcastRouter {
    private static final Logger log = LoggerFactory.getLogger(BroadcastRouter.class);

    private final SessionRegistry sessions;
    private final MessageCodec codec;
    private final SessionReaper reaper;

    public BroadcastRouter(SessionRegistry sessions, MessageCodec codec, SessionReaper reaper) {
        this.sessions = sessions;
        this.codec = codec;
        this.reaper = reaper;
    }

    public void publish(ServerMessage message) {
        publish(message, null);
    }

    /**
     * Sends {@code message} to every live session except {@code excludeSessionId}.
     */
    public void publish(ServerMessage message, String excludeSessionId) {
        TextMessage frame = codec.encode(message);
        int delivered = 0;
        for (Session session : sessions.liveSessions()) {
            if (session.id().equals(excludeSessionId)) {
                continue;
            }
            if (session.send(frame)) {
                delivered++;
            } else {
                reaper.reap(session, SessionReaper.SEND_FAILED);
            }
        }
        log.debug("Published {} to {} session(s)", message.type(), delivered);
    }

    /**
     * Sends to one session regardless of its state; used for snapshots and errors.
     */
    public boolean sendTo(Session session, ServerMessage message) {
        if (session.send(codec.encode(message))) {
            return true;
        }
        reaper.reap(session, SessionReaper.SEND_FAILED);
        return false;
    }
}
