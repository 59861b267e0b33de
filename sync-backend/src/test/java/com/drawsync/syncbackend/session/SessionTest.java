package com.drawsync.syncbackend.session;

import com.drawsync.syncbackend.support.RecordingTransport;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.TextMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionTest {

    private final AtomicInteger failures = new AtomicInteger();

    @Test
    void framesLeaveInTheOrderTheyWereQueued() throws InterruptedException {
        ExecutorService outbound = Executors.newCachedThreadPool();
        RecordingTransport transport = new RecordingTransport("s1");
        Session session = new Session(transport.session(), outbound, 1024 * 1024, s -> failures.incrementAndGet());
        try {
            for (int i = 0; i < 50; i++) {
                assertTrue(session.send(frame(i)));
            }

            List<Integer> seen = new ArrayList<>();
            transport.awaitReceived("error", 50).forEach(m -> seen.add(Integer.parseInt(m.get("message").asText())));
            assertEquals(50, seen.size());
            for (int i = 0; i < 50; i++) {
                assertEquals(i, seen.get(i));
            }
        } finally {
            outbound.shutdownNow();
        }
    }

    @Test
    void sendReturnsWhileThePeerIsStalled() throws InterruptedException {
        ExecutorService outbound = Executors.newCachedThreadPool();
        CountDownLatch release = new CountDownLatch(1);
        RecordingTransport transport = new RecordingTransport("s1");
        transport.stallSendsUntil(release);
        Session session = new Session(transport.session(), outbound, 1024 * 1024, s -> failures.incrementAndGet());
        try {
            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                assertTrue(session.send(frame(1)));
                assertTrue(session.send(frame(2)));
            });
            assertThat(transport.received()).isEmpty();

            release.countDown();
            assertEquals(2, transport.awaitReceived("error", 2).size());
        } finally {
            release.countDown();
            outbound.shutdownNow();
        }
    }

    @Test
    void backlogOverTheLimitIsRefused() {
        List<Runnable> parked = new ArrayList<>();
        RecordingTransport transport = new RecordingTransport("s1");
        Session session = new Session(transport.session(), parked::add, 16, s -> failures.incrementAndGet());

        assertTrue(session.send(new TextMessage("a frame longer than sixteen bytes")));
        assertFalse(session.send(new TextMessage("next")));

        parked.forEach(Runnable::run);
        assertTrue(session.send(new TextMessage("after drain")));
    }

    @Test
    void failedWriteIsReportedOnceAndLaterFramesAreRefused() {
        RecordingTransport transport = new RecordingTransport("s1");
        Session session = new Session(transport.session(), Runnable::run, 1024, s -> failures.incrementAndGet());
        transport.failSends();

        assertTrue(session.send(frame(1)));
        assertFalse(session.send(frame(2)));
        assertFalse(session.ping());
        assertEquals(1, failures.get());
    }

    @Test
    void closedTransportRefusesFrames() {
        RecordingTransport transport = new RecordingTransport("s1");
        Session session = new Session(transport.session(), Runnable::run, 1024, s -> failures.incrementAndGet());
        transport.drop();

        assertFalse(session.send(frame(1)));
        assertEquals(0, failures.get());
    }

    private static TextMessage frame(int sequence) {
        return new TextMessage("{\"type\":\"error\",\"message\":\"" + sequence + "\"}");
    }
}
