package com.drawsync.syncbackend.user;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "app_users",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_app_users_email", columnNames = "email"),
                @UniqueConstraint(name = "uk_app_users_username", columnNames = "username"),
                @UniqueConstraint(name = "uk_app_users_participant_id", columnNames = "participantId")
        })
public class AppUser {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Durable identity used on the canvas: operation authorship and presence are keyed by it.
     */
    @Column(nullable = false, length = 64)
    private String participantId;

    @Column(nullable = false, length = 160)
    private String email;

    @Column(nullable = false, length = 100)
    private String username;

    @Column(nullable = false)
    private String passwordHash;

    @Column(nullable = false, length = 16)
    private String color;

    @Column(nullable = false)
    private Instant createdAt = Instant.now();

    protected AppUser() {
    }

    public AppUser(String email, String username, String passwordHash, String color) {
        this.participantId = UUID.randomUUID().toString();
        this.email = email;
        this.username = username;
        this.passwordHash = passwordHash;
        this.color = color;
        this.createdAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public String getParticipantId() {
        return participantId;
    }

    public String getEmail() {
        return email;
    }

    public String getUsername() {
        return username;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public String getColor() {
        return color;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
