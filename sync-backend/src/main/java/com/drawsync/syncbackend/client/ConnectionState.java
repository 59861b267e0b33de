package com.drawsync.syncbackend.client;

public enum ConnectionState {
    IDLE,
    CONNECTING,
    /** Transport open, handshake sent, waiting for the snapshot. */
    SYNCING,
    LIVE,
    /** Waiting out the retry delay before the next attempt. */
    RECONNECTING,
    /** Retry ceiling reached. Terminal until {@link CanvasSyncClient#connect()} is called again. */
    DISCONNECTED,
    /** Closed on request. */
    CLOSED
}
