package com.drawsync.syncbackend.security;

import com.drawsync.syncbackend.user.AppUser;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;

/**
 * Issues and checks participant tokens. The subject is the participant id; display name
 * and color travel as claims so a handshake can be bound to the login that produced it.
 */
@Component
public class JwtService {
    static final String NAME_CLAIM = "name";
    static final String COLOR_CLAIM = "color";

    private final JwtProperties properties;
    private final Key signingKey;

    public JwtService(JwtProperties properties) {
        this.properties = properties;
        this.signingKey = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(AppUser user) {
        Date issuedAt = new Date();
        Date expiresAt = new Date(issuedAt.getTime() + properties.expiration());

        return Jwts.builder()
                .setSubject(user.getParticipantId())
                .claim(NAME_CLAIM, user.getUsername())
                .claim(COLOR_CLAIM, user.getColor())
                .setIssuedAt(issuedAt)
                .setExpiration(expiresAt)
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    public String extractParticipantId(String token) {
        return extractAllClaims(token).getSubject();
    }

    public boolean isTokenValid(String token, AppUser user) {
        Claims claims = extractAllClaims(token);
        return user.getParticipantId().equals(claims.getSubject()) && !claims.getExpiration().before(new Date());
    }

    /**
     * Verifies signature and expiry.
     *
     * @throws io.jsonwebtoken.JwtException if the token is not acceptable
     */
    public Claims extractAllClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .build()
                .parseClaimsJws(token)
                .getBody();
    }
}
