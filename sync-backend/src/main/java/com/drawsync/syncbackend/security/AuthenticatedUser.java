package com.drawsync.syncbackend.security;

import java.security.Principal;

public record AuthenticatedUser(Long id, String participantId, String username) implements Principal {
    @Override
    public String getName() {
        return participantId;
    }
}
