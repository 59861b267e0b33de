package com.drawsync.syncbackend.liveness;

import com.drawsync.syncbackend.config.CanvasSyncProperties;
import com.drawsync.syncbackend.session.Session;
import com.drawsync.syncbackend.session.SessionReaper;
import com.drawsync.syncbackend.session.SessionRegistry;
import com.drawsync.syncbackend.sync.CanvasSyncEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the two independent liveness checks.
 *
 * <ul>
 *   <li>Transport: every ping interval, a session that sent nothing (not even a pong)
 *   since the previous tick is reaped; the others are pinged again.</li>
 *   <li>Presence: participants whose application heartbeats stopped are shown as
 *   inactive, even while their transport still answers pings.</li>
 * </ul>
 */
public class LivenessMonitor {
    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);
    private static final CloseStatus UNRESPONSIVE = CloseStatus.SESSION_NOT_RELIABLE.withReason("Ping timeout");

    private final SessionRegistry sessions;
    private final SessionReaper reaper;
    private final CanvasSyncEngine engine;
    private final CanvasSyncProperties.Liveness settings;
    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(1, r -> {
        Thread t = new Thread(r, "canvas-liveness");
        t.setDaemon(true);
        return t;
    });

    public LivenessMonitor(SessionRegistry sessions,
                           SessionReaper reaper,
                           CanvasSyncEngine engine,
                           CanvasSyncProperties.Liveness settings) {
        this.sessions = sessions;
        this.reaper = reaper;
        this.engine = engine;
        this.settings = settings;
    }

    public void start() {
        long pingMs = settings.getPingInterval().toMillis();
        long sweepMs = settings.getPresenceSweepInterval().toMillis();
        scheduler.scheduleAtFixedRate(guarded(this::checkTransports), pingMs, pingMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(guarded(this::sweepPresence), sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        log.info("Liveness monitor started: ping every {} ms, presence timeout {} ms",
                pingMs, settings.getPresenceTimeout().toMillis());
    }

    public void stop() {
        scheduler.shutdownNow();
        log.info("Liveness monitor stopped");
    }

    /**
     * One transport round.
     *
     * @return number of sessions handed to the reaper
     */
    public int checkTransports() {
        int evicted = 0;
        for (Session session : sessions.all()) {
            if (!session.resetTransportConfirmation()) {
                log.info("Session {} missed a ping interval", session.id());
                reaper.reap(session, UNRESPONSIVE);
                evicted++;
            } else if (!session.ping()) {
                reaper.reap(session, UNRESPONSIVE);
                evicted++;
            }
        }
        return evicted;
    }

    public void sweepPresence() {
        engine.sweepPresence();
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Liveness task failed", e);
            }
        };
    }
}
