package com.drawsync.syncbackend.protocol;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Binds a fresh session to a participant. The participant id itself is checked by the
 * handshake verifier, since a bad id is an identity failure rather than a schema one.
 */
public record HandshakeMessage(
        String participantId,
        @Size(max = 80, message = "displayName must be at most 80 characters") String displayName,
        @Pattern(regexp = "^#[0-9A-Fa-f]{3,8}$", message = "color must be a hex color such as #3B82F6") String color,
        @Size(max = 4096, message = "token is too long") String token
) implements ClientMessage {
    @Override
    public MessageType type() {
        return MessageType.HANDSHAKE;
    }
}
