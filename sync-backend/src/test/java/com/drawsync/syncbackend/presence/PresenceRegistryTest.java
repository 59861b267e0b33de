package com.drawsync.syncbackend.presence;

import com.drawsync.syncbackend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PresenceRegistryTest {

    private static final Participant ALICE = new Participant("alice", "Alice", "#FF6B6B");
    private static final Participant BOB = new Participant("bob", "Bob", "#4ECDC4");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final PresenceRegistry registry = new PresenceRegistry(clock);

    @Test
    void firstSessionJoinsLaterSessionsDoNot() {
        assertEquals(PresenceChange.JOINED, registry.attach(ALICE, "s1"));
        assertEquals(PresenceChange.UNCHANGED, registry.attach(ALICE, "s2"));

        assertEquals(1, registry.size());
        assertEquals(2, registry.find("alice").orElseThrow().sessions());
    }

    @Test
    void participantStaysPresentWhileAnySessionRemains() {
        registry.attach(ALICE, "s1");
        registry.attach(ALICE, "s2");

        assertFalse(registry.detach("alice", "s1"));
        assertTrue(registry.isPresent("alice"));

        assertTrue(registry.detach("alice", "s2"));
        assertFalse(registry.isPresent("alice"));
    }

    @Test
    void detachOfUnknownSessionIsIgnored() {
        registry.attach(ALICE, "s1");

        assertFalse(registry.detach("alice", "other"));
        assertFalse(registry.detach("nobody", "s1"));
        assertTrue(registry.isPresent("alice"));
    }

    @Test
    void missingHeartbeatsMakeParticipantInactiveButPresent() {
        registry.attach(ALICE, "s1");
        registry.attach(BOB, "s2");

        clock.advance(Duration.ofSeconds(3));
        registry.heartbeat("bob");
        clock.advance(Duration.ofSeconds(3));

        assertThat(registry.expireHeartbeats(TIMEOUT)).containsExactly("alice");
        assertTrue(registry.isPresent("alice"));
        assertFalse(registry.find("alice").orElseThrow().active());
        assertTrue(registry.find("bob").orElseThrow().active());

        assertThat(registry.expireHeartbeats(TIMEOUT)).isEmpty();
    }

    @Test
    void heartbeatReactivates() {
        registry.attach(ALICE, "s1");
        clock.advance(Duration.ofSeconds(6));
        registry.expireHeartbeats(TIMEOUT);

        assertTrue(registry.heartbeat("alice"));
        assertFalse(registry.heartbeat("alice"));
        assertTrue(registry.find("alice").orElseThrow().active());
        assertEquals(clock.instant().toEpochMilli(), registry.find("alice").orElseThrow().lastSeen());
    }

    @Test
    void newSessionOfInactiveParticipantReactivates() {
        registry.attach(ALICE, "s1");
        clock.advance(Duration.ofSeconds(6));
        registry.expireHeartbeats(TIMEOUT);

        assertEquals(PresenceChange.REACTIVATED, registry.attach(ALICE, "s2"));
    }

    @Test
    void cursorIsKeptOnlyForPresentParticipants() {
        registry.attach(ALICE, "s1");

        assertTrue(registry.updateCursor("alice", new Point(10, 20)));
        assertFalse(registry.updateCursor("bob", new Point(1, 1)));
        assertEquals(new Point(10, 20), registry.find("alice").orElseThrow().cursor());
    }

    @Test
    void snapshotIsSortedById() {
        registry.attach(BOB, "s2");
        registry.attach(ALICE, "s1");

        assertThat(registry.snapshot()).extracting(PresenceView::id).containsExactly("alice", "bob");
    }
}
