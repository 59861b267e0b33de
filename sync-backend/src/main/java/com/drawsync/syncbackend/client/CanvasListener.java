package com.drawsync.syncbackend.client;

import com.drawsync.syncbackend.oplog.Operation;
import com.drawsync.syncbackend.presence.Participant;
import com.drawsync.syncbackend.presence.Point;

/**
 * Subscription feed for a UI layer. Callbacks arrive on transport threads.
 */
public interface CanvasListener {

    default void onStateChange(ConnectionState state) {
    }

    /**
     * The local view was rebuilt from a server snapshot.
     */
    default void onSnapshot(CanvasState state) {
    }

    default void onOperation(Operation operation) {
    }

    default void onClear(String operationId, String participantId) {
    }

    default void onCursor(String participantId, Point point) {
    }

    default void onPresenceJoin(Participant participant) {
    }

    default void onPresenceLeave(String participantId) {
    }

    default void onPresenceUpdate(String participantId, boolean active) {
    }

    default void onError(String message) {
    }
}
