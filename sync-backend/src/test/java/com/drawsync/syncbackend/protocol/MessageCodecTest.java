package com.drawsync.syncbackend.protocol;

import com.drawsync.syncbackend.oplog.Operation;
import com.drawsync.syncbackend.oplog.OperationKind;
import com.drawsync.syncbackend.presence.Participant;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

class MessageCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final MessageCodec codec = new MessageCodec(mapper,
            Validation.buildDefaultValidatorFactory().getValidator());

    @Test
    void decodesOperation() {
        ClientMessage message = codec.decode("""
                {"type":"operation","operation":{"id":"op-1","kind":"stroke","authorId":"alice",
                 "payload":{"tool":"pen","color":"#000000","width":2,"points":[{"x":1,"y":2}]}}}
                """);

        OperationMessage operation = assertInstanceOf(OperationMessage.class, message);
        assertEquals("op-1", operation.operation().id());
        assertEquals(OperationKind.STROKE, operation.operation().kind());
        assertEquals("pen", operation.operation().payload().get("tool"));
    }

    @Test
    void decodesHandshakeAndIgnoresUnknownFields() {
        HandshakeMessage handshake = assertInstanceOf(HandshakeMessage.class, codec.decode(
                "{\"type\":\"handshake\",\"participantId\":\"alice\",\"displayName\":\"Alice\","
                        + "\"color\":\"#FF6B6B\",\"clientVersion\":3}"));

        assertEquals("alice", handshake.participantId());
        assertNull(handshake.token());
    }

    @Test
    void decodesClearWithoutId() {
        ClearMessage clear = assertInstanceOf(ClearMessage.class, codec.decode("{\"type\":\"clear\"}"));

        assertNull(clear.id());
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> codec.decode("{\"type\":"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageStartingWith("Malformed JSON");
    }

    @Test
    void rejectsNonObjectAndMissingType() {
        assertThatThrownBy(() -> codec.decode("[1,2]"))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("Message must be a JSON object");
        assertThatThrownBy(() -> codec.decode("{\"participantId\":\"alice\"}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("Message type is required");
    }

    @Test
    void rejectsServerOnlyAndUnknownTypes() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"snapshot\"}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("Unsupported message type: snapshot");
        assertThatThrownBy(() -> codec.decode("{\"type\":\"teleport\"}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("Unsupported message type: teleport");
    }

    @Test
    void rejectsOperationWithoutId() {
        assertThatThrownBy(() -> codec.decode(
                "{\"type\":\"operation\",\"operation\":{\"kind\":\"stroke\",\"payload\":{}}}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("operation.id is required");
    }

    @Test
    void rejectsUnknownOperationKind() {
        assertThatThrownBy(() -> codec.decode(
                "{\"type\":\"operation\",\"operation\":{\"id\":\"x\",\"kind\":\"blob\"}}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("Unknown operation kind: blob");
    }

    @Test
    void rejectsCursorWithoutCoordinates() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"cursorUpdate\",\"point\":{\"x\":4}}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("point.y is required");
    }

    @Test
    void rejectsBadHandshakeColor() {
        assertThatThrownBy(() -> codec.decode(
                "{\"type\":\"handshake\",\"participantId\":\"alice\",\"color\":\"red\"}"))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("color must be a hex color");
    }

    @Test
    void encodesSnapshotWithoutUnusedFields() throws Exception {
        Operation op = new Operation("op-1", OperationKind.STROKE, "alice", Map.of("tool", "pen"), 1);

        JsonNode json = mapper.readTree(codec.encode(
                ServerMessage.snapshot("s1", List.of(), List.of(op), 1)).getPayload());

        assertEquals("snapshot", json.get("type").asText());
        assertEquals("s1", json.get("sessionId").asText());
        assertEquals(1, json.get("version").asLong());
        assertEquals("stroke", json.get("operations").get(0).get("kind").asText());
        assertFalse(json.has("operation"));
        assertFalse(json.has("message"));
    }

    @Test
    void encodesPresenceJoinWithParticipant() throws Exception {
        JsonNode json = mapper.readTree(codec.encode(
                ServerMessage.presenceJoin(new Participant("bob", "Bob", "#4ECDC4"))).getPayload());

        assertEquals("presenceJoin", json.get("type").asText());
        assertEquals("bob", json.get("participantId").asText());
        assertThat(json.get("participant").get("displayName").asText()).isEqualTo("Bob");
    }
}
