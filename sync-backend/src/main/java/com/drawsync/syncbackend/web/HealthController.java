package com.drawsync.syncbackend.web;

import com.drawsync.syncbackend.oplog.OperationLog;
import com.drawsync.syncbackend.oplog.PersistenceWriter;
import com.drawsync.syncbackend.presence.PresenceRegistry;
import com.drawsync.syncbackend.session.SessionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check plus operator telemetry. Persistence failures are reported here and
 * nowhere else; drawing clients never see them.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final SessionRegistry sessionRegistry;
    private final PresenceRegistry presenceRegistry;
    private final OperationLog operationLog;
    private final PersistenceWriter persistenceWriter;

    public HealthController(SessionRegistry sessionRegistry,
                            PresenceRegistry presenceRegistry,
                            OperationLog operationLog,
                            PersistenceWriter persistenceWriter) {
        this.sessionRegistry = sessionRegistry;
        this.presenceRegistry = presenceRegistry;
        this.operationLog = operationLog;
        this.persistenceWriter = persistenceWriter;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        long failures = persistenceWriter.failureCount();
        return ResponseEntity.ok(Map.of(
                "status", failures == 0 ? "UP" : "DEGRADED",
                "sessions", sessionRegistry.size(),
                "participants", presenceRegistry.size(),
                "version", operationLog.version(),
                "persistence", Map.of(
                        "written", persistenceWriter.writtenCount(),
                        "failures", failures)));
    }
}
