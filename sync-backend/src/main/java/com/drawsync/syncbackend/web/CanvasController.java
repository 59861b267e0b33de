package com.drawsync.syncbackend.web;

import com.drawsync.syncbackend.protocol.ServerMessage;
import com.drawsync.syncbackend.sync.CanvasSyncEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the canvas for callers that are not on the WebSocket.
 */
@RestController
@RequestMapping("/api/canvas")
public class CanvasController {
    private final CanvasSyncEngine engine;

    public CanvasController(CanvasSyncEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/snapshot")
    public ResponseEntity<ServerMessage> snapshot() {
        return ResponseEntity.ok(engine.snapshot());
    }
}
