package com.drawsync.syncbackend.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param secret     HMAC key material, at least 32 bytes
 * @param expiration token lifetime in milliseconds
 */
@ConfigurationProperties(prefix = "jwt")
public record JwtProperties(
        String secret,
        long expiration
) {
}
