package com.drawsync.syncbackend.oplog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * {@link OperationStore} backed by the {@code canvas_operations} table. Every entry is
 * retained, clear markers included, so the table doubles as an audit trail.
 */
@Component
public class JpaOperationStore implements OperationStore {
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final OperationRecordRepository repository;
    private final ObjectMapper objectMapper;

    public JpaOperationStore(OperationRecordRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void persist(Operation operation) {
        repository.save(new OperationRecord(
                operation.createdAt(),
                operation.id(),
                operation.kind(),
                operation.authorId(),
                writePayload(operation.payload())
        ));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Operation> loadAll() {
        return repository.findAllByOrderByPositionAsc().stream()
                .map(this::toOperation)
                .toList();
    }

    private Operation toOperation(OperationRecord record) {
        return new Operation(
                record.getOperationId(),
                record.getKind(),
                record.getAuthorId(),
                readPayload(record),
                record.getPosition()
        );
    }

    private String writePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Operation payload is not serializable", e);
        }
    }

    private Map<String, Object> readPayload(OperationRecord record) {
        try {
            return objectMapper.readValue(record.getPayloadJson(), PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload of operation " + record.getOperationId()
                    + " is corrupt", e);
        }
    }
}
