package com.drawsync.syncbackend.oplog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, append-only log of drawing operations and the single source of truth for
 * canvas content.
 *
 * <p>Positions are assigned in acceptance order and never reused. The id index covers
 * the whole history, so an operation hidden by a later clear is still recognised as a
 * duplicate. Only entries after the most recent clear are kept in memory; the durable
 * store behind {@link PersistenceWriter} keeps everything.
 */
public class OperationLog {
    private static final Logger log = LoggerFactory.getLogger(OperationLog.class);

    private final PersistenceWriter persistenceWriter;
    private final Map<String, Long> positionsById = new HashMap<>();
    private final List<Operation> visible = new ArrayList<>();
    private long version;
    private long lastClearPosition;

    public OperationLog(PersistenceWriter persistenceWriter) {
        this.persistenceWriter = persistenceWriter;
    }

    /**
     * Rebuilds the in-memory state from stored history. Only valid on an empty log.
     */
    public synchronized void restore(List<Operation> history) {
        if (version != 0) {
            throw new IllegalStateException("Operation log already holds " + version + " entries");
        }
        for (Operation operation : history) {
            if (operation.createdAt() <= version) {
                throw new IllegalStateException("Stored history is out of order at position "
                        + operation.createdAt());
            }
            positionsById.put(operation.id(), operation.createdAt());
            version = operation.createdAt();
            if (operation.isClear()) {
                visible.clear();
                lastClearPosition = operation.createdAt();
            } else {
                visible.add(operation);
            }
        }
        log.info("Operation log restored: version={}, visible={}, lastClear={}",
                version, visible.size(), lastClearPosition);
    }

    public synchronized AppendResult append(Operation operation) {
        if (operation.isClear()) {
            return clear(operation.id(), operation.authorId());
        }
        Long existing = positionsById.get(operation.id());
        if (existing != null) {
            log.debug("Duplicate operation {} ignored (position {})", operation.id(), existing);
            return AppendResult.duplicate(operation, existing);
        }
        Operation stored = accept(operation);
        visible.add(stored);
        return AppendResult.accepted(stored);
    }

    /**
     * Appends a clear marker. Afterwards {@link #snapshot()} only returns entries appended
     * after it.
     */
    public synchronized AppendResult clear(String clearId, String authorId) {
        Long existing = positionsById.get(clearId);
        if (existing != null) {
            log.debug("Duplicate clear {} ignored (position {})", clearId, existing);
            return AppendResult.duplicate(Operation.clearMarker(clearId, authorId), existing);
        }
        Operation marker = accept(Operation.clearMarker(clearId, authorId));
        int dropped = visible.size();
        visible.clear();
        lastClearPosition = marker.createdAt();
        log.info("Canvas cleared by {} at position {} ({} operations hidden)",
                authorId, marker.createdAt(), dropped);
        return AppendResult.accepted(marker);
    }

    private Operation accept(Operation operation) {
        Operation stored = operation.atPosition(++version);
        positionsById.put(stored.id(), stored.createdAt());
        persistenceWriter.submit(stored);
        return stored;
    }

    public synchronized List<Operation> snapshot() {
        return List.copyOf(visible);
    }

    public synchronized long version() {
        return version;
    }

    public synchronized long lastClearPosition() {
        return lastClearPosition;
    }

    public synchronized boolean contains(String operationId) {
        return positionsById.containsKey(operationId);
    }
}
