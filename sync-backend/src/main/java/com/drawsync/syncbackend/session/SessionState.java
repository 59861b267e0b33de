package com.drawsync.syncbackend.session;

/**
 * Per-connection lifecycle. A session only moves forward; a reconnecting client always
 * gets a new session that starts over at {@link #UNAUTHENTICATED}.
 */
public enum SessionState {
    /** Connected, no identity yet. Only a handshake is accepted. */
    UNAUTHENTICATED,
    /** Identity bound, snapshot being delivered. Receives no fan-out. */
    SYNCING,
    /** Snapshot delivered. Receives every broadcast and may submit events. */
    LIVE,
    CLOSED
}
