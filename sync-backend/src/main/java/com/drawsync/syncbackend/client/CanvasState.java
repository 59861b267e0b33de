package com.drawsync.syncbackend.client;

import com.drawsync.syncbackend.oplog.Operation;
import com.drawsync.syncbackend.presence.Participant;
import com.drawsync.syncbackend.presence.Point;
import com.drawsync.syncbackend.presence.PresenceView;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A client's local picture of the canvas.
 *
 * <p>Operations are keyed by id, so an operation that reaches the client twice (live and
 * again in a reconnect snapshot, or echoed back after an optimistic local render) is
 * rendered once. The version tracks the server's log version; a jump of more than one
 * marks the state stale, meaning updates were missed and a resync is due.
 */
public class CanvasState {

    private final Map<String, Operation> confirmed = new LinkedHashMap<>();
    private final Map<String, Operation> pending = new LinkedHashMap<>();
    private final Map<String, PresenceView> participants = new LinkedHashMap<>();
    private long version;
    private boolean stale;

    /**
     * Replaces the confirmed view with the server's. Pending local operations the snapshot
     * already contains are confirmed; the rest stay pending.
     */
    public synchronized void applySnapshot(List<Operation> operations, List<PresenceView> present, long snapshotVersion) {
        confirmed.clear();
        for (Operation operation : operations) {
            confirmed.putIfAbsent(operation.id(), operation);
        }
        pending.keySet().removeAll(confirmed.keySet());
        participants.clear();
        for (PresenceView view : present) {
            participants.put(view.id(), view);
        }
        version = snapshotVersion;
        stale = false;
    }

    /**
     * @return false if the operation was already known
     */
    public synchronized boolean applyOperation(Operation operation, long newVersion) {
        pending.remove(operation.id());
        if (confirmed.containsKey(operation.id())) {
            return false;
        }
        advance(newVersion);
        confirmed.put(operation.id(), operation);
        return true;
    }

    public synchronized void applyClear(long newVersion) {
        advance(newVersion);
        confirmed.clear();
    }

    private void advance(long newVersion) {
        if (newVersion > version + 1) {
            stale = true;
        }
        version = Math.max(version, newVersion);
    }

    /**
     * Records an operation rendered optimistically before the server confirmed it.
     */
    public synchronized void addPending(Operation operation) {
        if (!confirmed.containsKey(operation.id())) {
            pending.put(operation.id(), operation);
        }
    }

    public synchronized void presenceJoin(Participant participant, long now) {
        participants.put(participant.id(), new PresenceView(participant.id(), participant.displayName(),
                participant.color(), true, now, null, 1));
    }

    public synchronized void presenceLeave(String participantId) {
        participants.remove(participantId);
    }

    public synchronized void presenceUpdate(String participantId, boolean active) {
        participants.computeIfPresent(participantId, (id, v) ->
                new PresenceView(v.id(), v.displayName(), v.color(), active, v.lastSeen(), v.cursor(), v.sessions()));
    }

    public synchronized void cursor(String participantId, Point point) {
        participants.computeIfPresent(participantId, (id, v) ->
                new PresenceView(v.id(), v.displayName(), v.color(), v.active(), v.lastSeen(), point, v.sessions()));
    }

    /**
     * Confirmed operations in log order, followed by pending ones in submission order.
     */
    public synchronized List<Operation> operations() {
        List<Operation> all = new ArrayList<>(confirmed.values());
        all.addAll(pending.values());
        return all;
    }

    public synchronized List<Operation> pendingOperations() {
        return List.copyOf(pending.values());
    }

    public synchronized Map<String, PresenceView> participants() {
        return Map.copyOf(participants);
    }

    public synchronized long version() {
        return version;
    }

    public synchronized boolean isStale() {
        return stale;
    }
}
