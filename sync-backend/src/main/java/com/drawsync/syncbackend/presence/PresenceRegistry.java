package com.drawsync.syncbackend.presence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks which participants are present and whether they are still heartbeating.
 *
 * <p>Presence is per participant: a participant stays present while at least one of its
 * sessions is attached. The active flag is driven only by application heartbeats and is
 * independent of transport liveness.
 */
public class PresenceRegistry {
    private static final Logger log = LoggerFactory.getLogger(PresenceRegistry.class);

    private final Clock clock;
    private final Map<String, Entry> present = new LinkedHashMap<>();

    public PresenceRegistry(Clock clock) {
        this.clock = clock;
    }

    public synchronized PresenceChange attach(Participant participant, String sessionId) {
        Instant now = clock.instant();
        Entry entry = present.get(participant.id());
        if (entry == null) {
            entry = new Entry(participant, now);
            entry.sessionIds.add(sessionId);
            present.put(participant.id(), entry);
            log.info("Participant {} is present (session {})", participant.id(), sessionId);
            return PresenceChange.JOINED;
        }
        entry.sessionIds.add(sessionId);
        entry.lastHeartbeatAt = now;
        if (!entry.active) {
            entry.active = true;
            return PresenceChange.REACTIVATED;
        }
        return PresenceChange.UNCHANGED;
    }

    /**
     * @return true when this was the participant's last session and it is now absent
     */
    public synchronized boolean detach(String participantId, String sessionId) {
        Entry entry = present.get(participantId);
        if (entry == null || !entry.sessionIds.remove(sessionId)) {
            return false;
        }
        if (!entry.sessionIds.isEmpty()) {
            log.debug("Participant {} keeps {} session(s) after {} left",
                    participantId, entry.sessionIds.size(), sessionId);
            return false;
        }
        present.remove(participantId);
        log.info("Participant {} is absent", participantId);
        return true;
    }

    /**
     * @return true when the heartbeat flipped an inactive participant back to active
     */
    public synchronized boolean heartbeat(String participantId) {
        Entry entry = present.get(participantId);
        if (entry == null) {
            return false;
        }
        entry.lastHeartbeatAt = clock.instant();
        if (entry.active) {
            return false;
        }
        entry.active = true;
        log.info("Participant {} is active again", participantId);
        return true;
    }

    public synchronized boolean updateCursor(String participantId, Point cursor) {
        Entry entry = present.get(participantId);
        if (entry == null) {
            return false;
        }
        entry.cursor = cursor;
        return true;
    }

    /**
     * Marks every active participant whose last heartbeat is older than {@code timeout}
     * as inactive.
     *
     * @return ids of the participants that just became inactive
     */
    public synchronized List<String> expireHeartbeats(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        List<String> expired = new ArrayList<>();
        for (Entry entry : present.values()) {
            if (entry.active && entry.lastHeartbeatAt.isBefore(cutoff)) {
                entry.active = false;
                expired.add(entry.participant.id());
            }
        }
        if (!expired.isEmpty()) {
            log.info("Heartbeat timeout, now inactive: {}", expired);
        }
        return expired;
    }

    public synchronized List<PresenceView> snapshot() {
        return present.values().stream()
                .map(Entry::view)
                .sorted(Comparator.comparing(PresenceView::id))
                .toList();
    }

    public synchronized Optional<PresenceView> find(String participantId) {
        return Optional.ofNullable(present.get(participantId)).map(Entry::view);
    }

    public synchronized boolean isPresent(String participantId) {
        return present.containsKey(participantId);
    }

    public synchronized int size() {
        return present.size();
    }

    private static final class Entry {
        private final Participant participant;
        private final Set<String> sessionIds = new LinkedHashSet<>();
        private Instant lastHeartbeatAt;
        private boolean active = true;
        private Point cursor;

        private Entry(Participant participant, Instant now) {
            this.participant = participant;
            this.lastHeartbeatAt = now;
        }

        private PresenceView view() {
            return new PresenceView(
                    participant.id(),
                    participant.displayName(),
                    participant.color(),
                    active,
                    lastHeartbeatAt.toEpochMilli(),
                    cursor,
                    sessionIds.size());
        }
    }
}
