package com.drawsync.syncbackend.protocol;

import java.util.Optional;

/**
 * Values of the {@code type} discriminator carried by every wire message.
 */
public enum MessageType {
    HANDSHAKE("handshake", HandshakeMessage.class),
    SNAPSHOT("snapshot", null),
    OPERATION("operation", OperationMessage.class),
    CURSOR_UPDATE("cursorUpdate", CursorUpdateMessage.class),
    CLEAR("clear", ClearMessage.class),
    PRESENCE_JOIN("presenceJoin", null),
    PRESENCE_LEAVE("presenceLeave", null),
    PRESENCE_UPDATE("presenceUpdate", null),
    HEARTBEAT("heartbeat", HeartbeatMessage.class),
    LEAVE("leave", LeaveMessage.class),
    ERROR("error", null);

    private final String wireName;
    private final Class<? extends ClientMessage> inboundType;

    MessageType(String wireName, Class<? extends ClientMessage> inboundType) {
        this.wireName = wireName;
        this.inboundType = inboundType;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isInbound() {
        return inboundType != null;
    }

    Class<? extends ClientMessage> inboundType() {
        return inboundType;
    }

    public static Optional<MessageType> fromWire(String value) {
        for (MessageType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
