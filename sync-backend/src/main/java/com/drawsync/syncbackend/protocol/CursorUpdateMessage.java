package com.drawsync.syncbackend.protocol;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record CursorUpdateMessage(
        String participantId,
        @NotNull(message = "point is required") @Valid CursorPoint point
) implements ClientMessage {
    @Override
    public MessageType type() {
        return MessageType.CURSOR_UPDATE;
    }
}
