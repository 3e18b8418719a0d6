package com.tandem.core.security;

import com.tandem.core.model.Actor;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves {@code Bearer <jwt>} credentials. The subject must be a numeric user id.
 */
@Component
public class JwtActorResolver implements ActorResolver {

    private static final Logger log = LoggerFactory.getLogger(JwtActorResolver.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService tokenService;

    public JwtActorResolver(JwtTokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public Optional<Actor> resolve(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        try {
            Claims claims = tokenService.validateToken(token);
            long userId = Long.parseLong(claims.getSubject());
            return Optional.of(new Actor(userId, claims.get(JwtTokenService.NAME_CLAIM, String.class)));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
