package com.drawsync.syncbackend.oplog;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "canvas_operations",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_canvas_operations_operation_id", columnNames = "operationId")
        })
public class OperationRecord {
    @Id
    private Long position;

    @Column(nullable = false, length = 128)
    private String operationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OperationKind kind;

    @Column(nullable = false, length = 64)
    private String authorId;

    @Lob
    @Column(nullable = false)
    private String payloadJson;

    @Column(nullable = false)
    private Instant recordedAt = Instant.now();

    protected OperationRecord() {
    }

    public OperationRecord(Long position, String operationId, OperationKind kind, String authorId, String payloadJson) {
        this.position = position;
        this.operationId = operationId;
        this.kind = kind;
        this.authorId = authorId;
        this.payloadJson = payloadJson;
        this.recordedAt = Instant.now();
    }

    public Long getPosition() {
        return position;
    }

    public String getOperationId() {
        return operationId;
    }

    public OperationKind getKind() {
        return kind;
    }

    public String getAuthorId() {
        return authorId;
    }

    public String getPayloadJson() {
        return payloadJson;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }
}
