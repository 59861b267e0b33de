package com.drawsync.syncbackend.oplog;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PersistenceWriterTest {

    private static final Operation OPERATION =
            new Operation("op-1", OperationKind.STROKE, "alice", Map.of("tool", "pen"), 1);

    @Test
    void countsSuccessfulWrites() {
        List<Operation> written = new ArrayList<>();
        PersistenceWriter writer = new PersistenceWriter(new ListStore(written), Runnable::run);

        writer.submit(OPERATION);

        assertEquals(List.of(OPERATION), written);
        assertEquals(1, writer.writtenCount());
        assertEquals(0, writer.failureCount());
    }

    @Test
    void rejectedWorkIsCountedAsFailure() {
        PersistenceWriter writer = new PersistenceWriter(new ListStore(new ArrayList<>()), task -> {
            throw new RejectedExecutionException("queue full");
        });

        writer.submit(OPERATION);

        assertEquals(1, writer.failureCount());
    }

    @Test
    void submitDoesNotWaitForTheStore() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        OperationStore slow = new ListStore(new ArrayList<>()) {
            @Override
            public void persist(Operation operation) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                done.countDown();
            }
        };
        PersistenceWriter writer = new PersistenceWriter(slow, Executors.newSingleThreadExecutor());

        writer.submit(OPERATION);
        assertEquals(0, writer.writtenCount());

        release.countDown();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        writer.shutdown();
        assertEquals(1, writer.writtenCount());
    }

    private static class ListStore implements OperationStore {
        private final List<Operation> written;

        ListStore(List<Operation> written) {
            this.written = written;
        }

        @Override
        public void persist(Operation operation) {
            written.add(operation);
        }

        @Override
        public List<Operation> loadAll() {
            return List.copyOf(written);
        }
    }
}
