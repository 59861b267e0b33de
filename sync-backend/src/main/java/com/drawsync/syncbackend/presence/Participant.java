package com.drawsync.syncbackend.presence;

/**
 * Durable, authenticated identity. Never changed or deleted by the sync server.
 */
public record Participant(String id, String displayName, String color) {
}
