package com.drawsync.syncbackend.protocol;

import jakarta.validation.constraints.Size;

/**
 * @param id optional client-generated id; lets a retried clear be recognised as a duplicate
 */
public record ClearMessage(
        @Size(max = 128, message = "id must be at most 128 characters") String id
) implements ClientMessage {
    @Override
    public MessageType type() {
        return MessageType.CLEAR;
    }
}
