package com.drawsync.syncbackend.protocol;

/**
 * A single inbound message was malformed, incomplete or not allowed in the session's
 * current state.
 */
public class ProtocolException extends RuntimeException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
