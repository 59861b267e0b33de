package com.drawsync.syncbackend.oplog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes accepted operations to the {@link OperationStore} off the live path.
 * Callers never wait for the write; failures are logged and counted for operators.
 */
public class PersistenceWriter {
    private static final Logger log = LoggerFactory.getLogger(PersistenceWriter.class);

    private final OperationStore store;
    private final Executor executor;
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public PersistenceWriter(OperationStore store) {
        this(store, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "oplog-persistence");
            t.setDaemon(true);
            return t;
        }));
    }

    public PersistenceWriter(OperationStore store, Executor executor) {
        this.store = store;
        this.executor = executor;
    }

    public void submit(Operation operation) {
        try {
            executor.execute(() -> write(operation));
        } catch (RejectedExecutionException e) {
            failures.incrementAndGet();
            log.error("Persistence queue rejected operation {} at position {}",
                    operation.id(), operation.createdAt());
        }
    }

    private void write(Operation operation) {
        try {
            store.persist(operation);
            written.incrementAndGet();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.error("Failed to persist operation {} at position {}; it stays live in memory only",
                    operation.id(), operation.createdAt(), e);
        }
    }

    public long writtenCount() {
        return written.get();
    }

    public long failureCount() {
        return failures.get();
    }

    /**
     * Stops accepting work and waits briefly for queued writes to drain.
     */
    public void shutdown() {
        if (!(executor instanceof ExecutorService service)) {
            return;
        }
        service.shutdown();
        try {
            if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Persistence queue did not drain before shutdown");
                service.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            service.shutdownNow();
        }
    }
}
