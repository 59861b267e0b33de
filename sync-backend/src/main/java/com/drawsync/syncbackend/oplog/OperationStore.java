package com.drawsync.syncbackend.oplog;

import java.util.List;

/**
 * Durable storage for accepted operations. Implementations retain the full history,
 * clear markers included; what is visible is decided by {@link OperationLog}.
 */
public interface OperationStore {

    void persist(Operation operation);

    /**
     * @return every stored operation ordered by log position
     */
    List<Operation> loadAll();
}
