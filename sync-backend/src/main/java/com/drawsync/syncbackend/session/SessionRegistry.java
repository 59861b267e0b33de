package com.drawsync.syncbackend.session;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions by id. Mutated only by {@link SessionManager}; everything else reads.
 */
public class SessionRegistry {

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

    void register(Session session) {
        sessions.put(session.id(), session);
    }

    Session remove(String sessionId) {
        return sessions.remove(sessionId);
    }

    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Collection<Session> all() {
        return List.copyOf(sessions.values());
    }

    public List<Session> liveSessions() {
        return sessions.values().stream()
                .filter(Session::isLive)
                .toList();
    }

    public int size() {
        return sessions.size();
    }
}
