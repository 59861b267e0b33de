package com.drawsync.syncbackend.web.dto.auth;

import com.drawsync.syncbackend.user.AppUser;

import java.time.Instant;

public record UserProfileDto(
        String participantId,
        String username,
        String email,
        String color,
        Instant createdAt
) {
    public static UserProfileDto from(AppUser user) {
        return new UserProfileDto(user.getParticipantId(), user.getUsername(), user.getEmail(),
                user.getColor(), user.getCreatedAt());
    }
}
