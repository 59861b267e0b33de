package com.drawsync.syncbackend.session;

import com.drawsync.syncbackend.sync.CanvasSyncEngine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Tears down sessions found dead by the broadcast path or the liveness monitor. Cleanup
 * runs on its own thread so that a failing send never re-enters the fan-out loop.
 */
@Component
public class SessionReaper {
    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);
    public static final CloseStatus SEND_FAILED = CloseStatus.SESSION_NOT_RELIABLE.withReason("Send failed");

    private final Supplier<CanvasSyncEngine> engine;
    private final Executor executor;

    @Autowired
    public SessionReaper(ObjectProvider<CanvasSyncEngine> engineProvider) {
        this(engineProvider::getObject, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "session-reaper");
            t.setDaemon(true);
            return t;
        }));
    }

    public SessionReaper(Supplier<CanvasSyncEngine> engine, Executor executor) {
        this.engine = engine;
        this.executor = executor;
    }

    public void reap(Session session, CloseStatus status) {
        log.info("Scheduling cleanup of {} ({})", session, status.getReason());
        executor.execute(() -> {
            session.close(status);
            engine.get().disconnect(session.id());
        });
    }

    @PreDestroy
    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdownNow();
        }
    }
}
