package com.drawsync.syncbackend.client;

/**
 * What the client asserts in its handshake.
 *
 * @param token JWT from {@code /api/auth/login}; may be null when the server does not require one
 */
public record ClientIdentity(String participantId, String displayName, String color, String token) {
}
