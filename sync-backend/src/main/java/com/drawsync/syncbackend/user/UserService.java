package com.drawsync.syncbackend.user;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * The authentication collaborator: registers accounts and checks credentials. The sync
 * core only ever sees the resulting participant id, name and color.
 */
@Service
public class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    private static final List<String> PALETTE = List.of(
            "#3B82F6", "#14B8A6", "#F97316", "#EF4444", "#8B5CF6", "#10B981");

    private final AppUserRepository repository;
    private final PasswordEncoder passwordEncoder;

    public UserService(AppUserRepository repository, PasswordEncoder passwordEncoder) {
        this.repository = repository;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional
    public AppUser registerUser(String email, String username, String rawPassword, String color) {
        String normalizedEmail = normalizeEmail(email);
        String normalizedUsername = username.trim();

        if (repository.existsByEmailIgnoreCase(normalizedEmail)) {
            throw new IllegalArgumentException("Email is already registered");
        }
        if (repository.existsByUsernameIgnoreCase(normalizedUsername)) {
            throw new IllegalArgumentException("Username is already taken");
        }

        AppUser user = new AppUser(
                normalizedEmail,
                normalizedUsername,
                passwordEncoder.encode(rawPassword),
                color != null && !color.isBlank() ? color : randomColor()
        );
        AppUser saved = repository.save(user);
        log.info("Registered participant '{}' as {}", saved.getUsername(), saved.getParticipantId());
        return saved;
    }

    public AppUser authenticate(String email, String rawPassword) {
        AppUser user = repository.findByEmailIgnoreCase(normalizeEmail(email))
                .orElseThrow(() -> new IllegalArgumentException("Invalid credentials"));

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            throw new IllegalArgumentException("Invalid credentials");
        }
        return user;
    }

    public Optional<AppUser> findByParticipantId(String participantId) {
        if (participantId == null) {
            return Optional.empty();
        }
        return repository.findByParticipantId(participantId.trim());
    }

    private static String randomColor() {
        return PALETTE.get(ThreadLocalRandom.current().nextInt(PALETTE.size()));
    }

    private String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
