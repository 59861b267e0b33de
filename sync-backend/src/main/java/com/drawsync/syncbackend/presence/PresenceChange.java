package com.drawsync.syncbackend.presence;

/**
 * What attaching a session did to the participant's visible presence.
 */
public enum PresenceChange {
    /** First live session: the participant just became present. */
    JOINED,
    /** Already present but shown as inactive; now active again. */
    REACTIVATED,
    UNCHANGED
}
