package com.drawsync.syncbackend.protocol;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record OperationMessage(
        @NotNull(message = "operation is required") @Valid SubmittedOperation operation
) implements ClientMessage {
    @Override
    public MessageType type() {
        return MessageType.OPERATION;
    }
}
