package com.drawsync.syncbackend.web;

import com.drawsync.syncbackend.sync.CanvasSyncEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

/**
 * Transport adapter for {@code /ws/canvas}. Translates WebSocket callbacks into engine
 * events and holds no state of its own.
 */
@Component
public class CanvasWebSocketHandler extends AbstractWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(CanvasWebSocketHandler.class);

    private final CanvasSyncEngine engine;

    public CanvasWebSocketHandler(CanvasSyncEngine engine) {
        this.engine = engine;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        engine.connect(session);
        log.debug("Canvas WebSocket opened from {}", session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        engine.receive(session.getId(), message.getPayload());
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) throws Exception {
        log.warn("Binary frame from session {} refused", session.getId());
        session.close(CloseStatus.NOT_ACCEPTABLE.withReason("Text frames only"));
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        engine.pong(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
        engine.disconnect(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Canvas WebSocket {} closed: {}", session.getId(), status);
        engine.disconnect(session.getId());
    }
}
