package com.drawsync.syncbackend.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns raw text frames into validated {@link ClientMessage}s and {@link ServerMessage}s
 * into text frames.
 */
@Component
public class MessageCodec {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public MessageCodec(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper.copy()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.validator = validator;
    }

    public ClientMessage decode(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Message must be a JSON object");
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProtocolException("Message type is required");
        }
        MessageType type = MessageType.fromWire(typeNode.asText())
                .filter(MessageType::isInbound)
                .orElseThrow(() -> new ProtocolException("Unsupported message type: " + typeNode.asText()));

        ClientMessage message;
        try {
            message = objectMapper.treeToValue(root, type.inboundType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Invalid '" + type.wireName() + "' message: " + describe(e));
        }

        Set<ConstraintViolation<ClientMessage>> violations = validator.validate(message);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.joining("; "));
            throw new ProtocolException("Invalid '" + type.wireName() + "' message: " + details);
        }
        return message;
    }

    public TextMessage encode(ServerMessage message) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.type() + " message", e);
        }
    }

    private static String describe(Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        if (cause instanceof JsonProcessingException jsonError) {
            return jsonError.getOriginalMessage();
        }
        return cause.getMessage();
    }
}
