package com.drawsync.syncbackend.oplog;

/**
 * Outcome of {@link OperationLog#append(Operation)}.
 *
 * @param operation the stored operation, or the submitted one when it was a duplicate
 * @param position  log position of the stored entry (the original one for duplicates)
 * @param accepted  false when the id had already been seen
 */
public record AppendResult(Operation operation, long position, boolean accepted) {

    static AppendResult accepted(Operation operation) {
        return new AppendResult(operation, operation.createdAt(), true);
    }

    static AppendResult duplicate(Operation submitted, long originalPosition) {
        return new AppendResult(submitted, originalPosition, false);
    }
}
