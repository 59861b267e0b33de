package com.drawsync.syncbackend.oplog;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable, author-attributed drawing action.
 *
 * @param id        client-generated, globally unique id used for de-duplication
 * @param kind      stroke, erase or clear
 * @param authorId  durable participant id of the author
 * @param payload   tool, color, width and points; never interpreted by the server
 * @param createdAt log position assigned on acceptance, 0 while unaccepted
 */
public record Operation(
        String id,
        OperationKind kind,
        String authorId,
        Map<String, Object> payload,
        long createdAt
) {
    public Operation {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Operation submitted(String id, OperationKind kind, String authorId, Map<String, Object> payload) {
        return new Operation(id, kind, authorId, payload, 0);
    }

    public static Operation clearMarker(String id, String authorId) {
        return new Operation(id, OperationKind.CLEAR, authorId, Map.of(), 0);
    }

    Operation atPosition(long position) {
        return new Operation(id, kind, authorId, payload, position);
    }

    @JsonIgnore
    public boolean isClear() {
        return kind == OperationKind.CLEAR;
    }
}
