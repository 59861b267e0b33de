package com.drawsync.syncbackend.security;

import com.drawsync.syncbackend.user.AppUser;
import com.drawsync.syncbackend.user.UserService;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final JwtService jwtService;
    private final UserService userService;

    public JwtAuthenticationFilter(JwtService jwtService, UserService userService) {
        this.jwtService = jwtService;
        this.userService = userService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = authHeader.substring(7);
        String participantId;
        try {
            participantId = jwtService.extractParticipantId(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Ignoring unusable bearer token: {}", e.getMessage());
            filterChain.doFilter(request, response);
            return;
        }

        if (participantId != null && SecurityContextHolder.getContext().getAuthentication() == null) {
            userService.findByParticipantId(participantId).ifPresent(user -> authenticateUser(token, user));
        }

        filterChain.doFilter(request, response);
    }

    private void authenticateUser(String token, AppUser user) {
        if (!jwtService.isTokenValid(token, user)) {
            return;
        }
        AuthenticatedUser principal = new AuthenticatedUser(
                user.getId(),
                user.getParticipantId(),
                user.getUsername()
        );
        UsernamePasswordAuthenticationToken authenticationToken =
                new UsernamePasswordAuthenticationToken(
                        principal,
                        null,
                        List.of(new SimpleGrantedAuthority("ROLE_USER"))
                );
        SecurityContextHolder.getContext().setAuthentication(authenticationToken);
    }
}
