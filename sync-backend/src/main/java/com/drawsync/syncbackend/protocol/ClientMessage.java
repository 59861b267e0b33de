package com.drawsync.syncbackend.protocol;

/**
 * A decoded and validated client-to-server message.
 */
public interface ClientMessage {
    MessageType type();
}
