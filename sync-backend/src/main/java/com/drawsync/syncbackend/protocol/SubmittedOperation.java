package com.drawsync.syncbackend.protocol;

import com.drawsync.syncbackend.oplog.OperationKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record SubmittedOperation(
        @NotBlank(message = "operation.id is required")
        @Size(max = 128, message = "operation.id must be at most 128 characters")
        String id,
        @NotNull(message = "operation.kind is required") OperationKind kind,
        String authorId,
        Map<String, Object> payload
) {
}
