package com.drawsync.syncbackend.web;

import com.drawsync.syncbackend.security.AuthenticatedUser;
import com.drawsync.syncbackend.security.JwtService;
import com.drawsync.syncbackend.user.AppUser;
import com.drawsync.syncbackend.user.UserService;
import com.drawsync.syncbackend.web.dto.auth.AuthResponse;
import com.drawsync.syncbackend.web.dto.auth.SignInRequest;
import com.drawsync.syncbackend.web.dto.auth.SignUpRequest;
import com.drawsync.syncbackend.web.dto.auth.UserProfileDto;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Login and registration. The returned token is what a client presents in its canvas
 * handshake.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final UserService userService;
    private final JwtService jwtService;

    public AuthController(UserService userService, JwtService jwtService) {
        this.userService = userService;
        this.jwtService = jwtService;
    }

    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody SignUpRequest request) {
        AppUser user = userService.registerUser(request.email(), request.name(), request.password(), request.color());
        String token = jwtService.generateToken(user);
        return ResponseEntity.ok(AuthResponse.of(token, UserProfileDto.from(user)));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody SignInRequest request) {
        AppUser user = userService.authenticate(request.email(), request.password());
        String token = jwtService.generateToken(user);
        return ResponseEntity.ok(AuthResponse.of(token, UserProfileDto.from(user)));
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileDto> me(@AuthenticationPrincipal AuthenticatedUser principal) {
        if (principal == null) {
            return ResponseEntity.status(401).build();
        }
        return userService.findByParticipantId(principal.participantId())
                .map(UserProfileDto::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(401).build());
    }
}
