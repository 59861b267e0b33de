package com.drawsync.syncbackend.protocol;

/**
 * A handshake asserted an identity that cannot be accepted. Always closes the connection.
 */
public class IdentityException extends RuntimeException {
    public IdentityException(String message) {
        super(message);
    }
}
