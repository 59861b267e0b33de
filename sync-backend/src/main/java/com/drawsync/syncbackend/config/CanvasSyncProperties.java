package com.drawsync.syncbackend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for the canvas synchronization server, bound from {@code canvas.*}.
 */
@ConfigurationProperties(prefix = "canvas")
public class CanvasSyncProperties {

    private final Liveness liveness = new Liveness();
    private final Handshake handshake = new Handshake();
    private final Transport transport = new Transport();

    public Liveness getLiveness() {
        return liveness;
    }

    public Handshake getHandshake() {
        return handshake;
    }

    public Transport getTransport() {
        return transport;
    }

    public static class Liveness {
        /**
         * How often every open transport is pinged. A transport that stays silent for a
         * whole interval is evicted on the next tick.
         */
        private Duration pingInterval = Duration.ofSeconds(30);

        /**
         * How long a participant may go without an application heartbeat before it is
         * shown as inactive.
         */
        private Duration presenceTimeout = Duration.ofSeconds(5);

        private Duration presenceSweepInterval = Duration.ofSeconds(1);

        public Duration getPingInterval() {
            return pingInterval;
        }

        public void setPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
        }

        public Duration getPresenceTimeout() {
            return presenceTimeout;
        }

        public void setPresenceTimeout(Duration presenceTimeout) {
            this.presenceTimeout = presenceTimeout;
        }

        public Duration getPresenceSweepInterval() {
            return presenceSweepInterval;
        }

        public void setPresenceSweepInterval(Duration presenceSweepInterval) {
            this.presenceSweepInterval = presenceSweepInterval;
        }
    }

    public static class Handshake {
        /**
         * When true, a handshake without a signed participant token is rejected.
         */
        private boolean requireToken = false;

        private String defaultColor = "#000000";

        public boolean isRequireToken() {
            return requireToken;
        }

        public void setRequireToken(boolean requireToken) {
            this.requireToken = requireToken;
        }

        public String getDefaultColor() {
            return defaultColor;
        }

        public void setDefaultColor(String defaultColor) {
            this.defaultColor = defaultColor;
        }
    }

    public static class Transport {
        /**
         * Longest a single socket write may block before the peer is dropped.
         */
        private Duration sendTimeLimit = Duration.ofSeconds(10);
        /**
         * Queued outbound bytes per session beyond which new frames are refused.
         */
        private int sendBufferSizeLimit = 512 * 1024;
        private int maxTextMessageSize = 50 * 1024 * 1024;

        public Duration getSendTimeLimit() {
            return sendTimeLimit;
        }

        public void setSendTimeLimit(Duration sendTimeLimit) {
            this.sendTimeLimit = sendTimeLimit;
        }

        public int getSendBufferSizeLimit() {
            return sendBufferSizeLimit;
        }

        public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
            this.sendBufferSizeLimit = sendBufferSizeLimit;
        }

        public int getMaxTextMessageSize() {
            return maxTextMessageSize;
        }

        public void setMaxTextMessageSize(int maxTextMessageSize) {
            this.maxTextMessageSize = maxTextMessageSize;
        }
    }
}
