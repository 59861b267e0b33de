package com.drawsync.syncbackend.protocol;

import com.drawsync.syncbackend.oplog.Operation;
import com.drawsync.syncbackend.presence.Participant;
import com.drawsync.syncbackend.presence.Point;
import com.drawsync.syncbackend.presence.PresenceView;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Every server-to-client message. Fields that do not apply to a given type are left
 * null and omitted from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(
        String type,
        String sessionId,
        List<PresenceView> participants,
        List<Operation> operations,
        Long version,
        Operation operation,
        String operationId,
        String participantId,
        Participant participant,
        Point point,
        Boolean active,
        String message
) {
    public static ServerMessage snapshot(String sessionId, List<PresenceView> participants,
                                         List<Operation> operations, long version) {
        return new ServerMessage(MessageType.SNAPSHOT.wireName(), sessionId, participants, operations, version,
                null, null, null, null, null, null, null);
    }

    public static ServerMessage operation(Operation operation, long version) {
        return new ServerMessage(MessageType.OPERATION.wireName(), null, null, null, version,
                operation, null, null, null, null, null, null);
    }

    public static ServerMessage clear(String operationId, String participantId, long version) {
        return new ServerMessage(MessageType.CLEAR.wireName(), null, null, null, version,
                null, operationId, participantId, null, null, null, null);
    }

    public static ServerMessage cursorUpdate(String participantId, Point point) {
        return new ServerMessage(MessageType.CURSOR_UPDATE.wireName(), null, null, null, null,
                null, null, participantId, null, point, null, null);
    }

    public static ServerMessage presenceJoin(Participant participant) {
        return new ServerMessage(MessageType.PRESENCE_JOIN.wireName(), null, null, null, null,
                null, null, participant.id(), participant, null, null, null);
    }

    public static ServerMessage presenceLeave(String participantId) {
        return new ServerMessage(MessageType.PRESENCE_LEAVE.wireName(), null, null, null, null,
                null, null, participantId, null, null, null, null);
    }

    public static ServerMessage presenceUpdate(String participantId, boolean active) {
        return new ServerMessage(MessageType.PRESENCE_UPDATE.wireName(), null, null, null, null,
                null, null, participantId, null, null, active, null);
    }

    public static ServerMessage error(String message) {
        return new ServerMessage(MessageType.ERROR.wireName(), null, null, null, null,
                null, null, null, null, null, null, message);
    }
}
