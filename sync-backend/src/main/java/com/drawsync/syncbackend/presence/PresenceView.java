package com.drawsync.syncbackend.presence;

/**
 * Read-only picture of one present participant, as sent in snapshots.
 *
 * @param lastSeen epoch millis of the last application heartbeat
 * @param sessions number of live sessions currently bound to the participant
 */
public record PresenceView(
        String id,
        String displayName,
        String color,
        boolean active,
        long lastSeen,
        Point cursor,
        int sessions
) {
}
