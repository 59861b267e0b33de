package com.drawsync.syncbackend.security;

import com.drawsync.syncbackend.config.CanvasSyncProperties;
import com.drawsync.syncbackend.presence.Participant;
import com.drawsync.syncbackend.protocol.HandshakeMessage;
import com.drawsync.syncbackend.protocol.IdentityException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Decides whether the identity asserted in a handshake is accepted.
 *
 * <p>A bare participant id is trusted unless {@code canvas.handshake.require-token} is
 * set. A token, when present, must verify and its subject must be the asserted id; its
 * name and color claims then fill in anything the handshake left out.
 */
@Component
public class HandshakeVerifier {
    private static final Pattern PARTICIPANT_ID = Pattern.compile("[A-Za-z0-9_.:@-]{1,64}");

    private final JwtService jwtService;
    private final CanvasSyncProperties.Handshake settings;

    public HandshakeVerifier(JwtService jwtService, CanvasSyncProperties properties) {
        this.jwtService = jwtService;
        this.settings = properties.getHandshake();
    }

    public Participant verify(HandshakeMessage handshake) {
        String participantId = handshake.participantId();
        if (participantId == null || participantId.isBlank()) {
            throw new IdentityException("participantId is required");
        }
        if (!PARTICIPANT_ID.matcher(participantId).matches()) {
            throw new IdentityException("participantId is malformed");
        }

        String displayName = handshake.displayName();
        String color = handshake.color();
        String token = handshake.token();
        if (token == null || token.isBlank()) {
            if (settings.isRequireToken()) {
                throw new IdentityException("A participant token is required");
            }
        } else {
            Claims claims = verifyToken(token);
            if (!participantId.equals(claims.getSubject())) {
                throw new IdentityException("Token was not issued to " + participantId);
            }
            displayName = firstNonBlank(displayName, claims.get(JwtService.NAME_CLAIM, String.class));
            color = firstNonBlank(color, claims.get(JwtService.COLOR_CLAIM, String.class));
        }

        return new Participant(
                participantId,
                firstNonBlank(displayName, participantId),
                firstNonBlank(color, settings.getDefaultColor()));
    }

    private Claims verifyToken(String token) {
        try {
            return jwtService.extractAllClaims(token);
        } catch (JwtException | IllegalArgumentException e) {
            throw new IdentityException("Participant token rejected: " + e.getMessage());
        }
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred.trim() : fallback;
    }
}
