package com.drawsync.syncbackend.client;

import java.net.URI;
import java.time.Duration;

/**
 * @param maxAttempts       connection attempts per outage before giving up
 * @param retryDelay        wait between attempts
 * @param heartbeatInterval cadence of application heartbeats while live
 */
public record ClientOptions(URI endpoint, int maxAttempts, Duration retryDelay, Duration heartbeatInterval) {

    public ClientOptions {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static ClientOptions defaults(URI endpoint) {
        return new ClientOptions(endpoint, 5, Duration.ofSeconds(3), Duration.ofSeconds(1));
    }
}
