package com.drawsync.syncbackend.config;

import com.drawsync.syncbackend.broadcast.BroadcastRouter;
import com.drawsync.syncbackend.liveness.LivenessMonitor;
import com.drawsync.syncbackend.oplog.OperationLog;
import com.drawsync.syncbackend.oplog.OperationStore;
import com.drawsync.syncbackend.oplog.PersistenceWriter;
import com.drawsync.syncbackend.presence.PresenceRegistry;
import com.drawsync.syncbackend.security.HandshakeVerifier;
import com.drawsync.syncbackend.session.SessionManager;
import com.drawsync.syncbackend.session.SessionReaper;
import com.drawsync.syncbackend.session.SessionRegistry;
import com.drawsync.syncbackend.sync.CanvasSyncEngine;
import com.drawsync.syncbackend.sync.ReconciliationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the shared state of the canvas authority: one operation log, one presence
 * registry and one session registry per process.
 */
@Configuration
public class SyncConfig {
    private static final Logger log = LoggerFactory.getLogger(SyncConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public PersistenceWriter persistenceWriter(OperationStore operationStore) {
        return new PersistenceWriter(operationStore);
    }

    @Bean
    public OperationLog operationLog(PersistenceWriter persistenceWriter, OperationStore operationStore) {
        OperationLog operationLog = new OperationLog(persistenceWriter);
        try {
            operationLog.restore(operationStore.loadAll());
        } catch (RuntimeException e) {
            log.error("Failed to restore the operation log from storage", e);
            throw new IllegalStateException("Operation log recovery failed", e);
        }
        return operationLog;
    }

    @Bean
    public PresenceRegistry presenceRegistry(Clock clock) {
        return new PresenceRegistry(clock);
    }

    @Bean
    public SessionRegistry sessionRegistry() {
        return new SessionRegistry();
    }

    @Bean(destroyMethod = "shutdown")
    public SessionManager sessionManager(SessionRegistry sessionRegistry,
                                         PresenceRegistry presenceRegistry,
                                         BroadcastRouter broadcastRouter,
                                         ReconciliationService reconciliationService,
                                         HandshakeVerifier handshakeVerifier,
                                         SessionReaper sessionReaper,
                                         CanvasSyncProperties properties) {
        CanvasSyncProperties.Transport transport = properties.getTransport();
        AtomicInteger threads = new AtomicInteger();
        ExecutorService outbound = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "canvas-outbound-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return new SessionManager(sessionRegistry, presenceRegistry, broadcastRouter, reconciliationService,
                handshakeVerifier, sessionReaper, outbound,
                transport.getSendTimeLimit(), transport.getSendBufferSizeLimit());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public LivenessMonitor livenessMonitor(SessionRegistry sessionRegistry,
                                           SessionReaper sessionReaper,
                                           CanvasSyncEngine canvasSyncEngine,
                                           CanvasSyncProperties properties) {
        return new LivenessMonitor(sessionRegistry, sessionReaper, canvasSyncEngine, properties.getLiveness());
    }
}
