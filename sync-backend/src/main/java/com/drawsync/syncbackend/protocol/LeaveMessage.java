package com.drawsync.syncbackend.protocol;

public record LeaveMessage() implements ClientMessage {
    @Override
    public MessageType type() {
        return MessageType.LEAVE;
    }
}
