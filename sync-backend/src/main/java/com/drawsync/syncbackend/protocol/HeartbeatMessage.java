package com.drawsync.syncbackend.protocol;

public record HeartbeatMessage(String participantId) implements ClientMessage {
    @Override
    public MessageType type() {
        return MessageType.HEARTBEAT;
    }
}
