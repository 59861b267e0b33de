package com.drawsync.syncbackend.user;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UserServiceTest {

    private final AppUserRepository repository = mock(AppUserRepository.class);
    private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private UserService userService;

    @BeforeEach
    void setUp() {
        userService = new UserService(repository, encoder);
        when(repository.save(any(AppUser.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void registersWithNormalizedEmailAndHashedPassword() {
        AppUser user = userService.registerUser(" Alice@Example.com ", "alice", "secret-pw", "#FF6B6B");

        assertEquals("alice@example.com", user.getEmail());
        assertEquals("#FF6B6B", user.getColor());
        assertThat(user.getParticipantId()).isNotBlank();
        assertThat(encoder.matches("secret-pw", user.getPasswordHash())).isTrue();
    }

    @Test
    void assignsPaletteColorWhenNoneGiven() {
        AppUser user = userService.registerUser("bob@example.com", "bob", "secret-pw", null);

        assertThat(user.getColor()).startsWith("#");
    }

    @Test
    void rejectsTakenEmail() {
        when(repository.existsByEmailIgnoreCase("alice@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.registerUser("alice@example.com", "alice", "secret-pw", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Email is already registered");
        verify(repository, never()).save(any());
    }

    @Test
    void authenticateChecksPassword() {
        AppUser stored = new AppUser("alice@example.com", "alice", encoder.encode("secret-pw"), "#FF6B6B");
        when(repository.findByEmailIgnoreCase("alice@example.com")).thenReturn(Optional.of(stored));

        assertEquals(stored, userService.authenticate("ALICE@example.com", "secret-pw"));
        assertThatThrownBy(() -> userService.authenticate("alice@example.com", "wrong"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid credentials");
    }
}
