package com.tandem.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.security.SignatureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenServiceTest {

    static final String SECRET = "tandem-test-secret-must-be-at-least-32-bytes-long";
    private static final int EXPIRATION_SECONDS = 600;

    private JwtTokenService service;

    @BeforeEach
    void setUp() {
        service = new JwtTokenService(SECRET, EXPIRATION_SECONDS);
    }

    @Nested
    @DisplayName("generateToken")
    class GenerateTokenTests {

        @Test
        @DisplayName("carries the user id as subject and the display name as a claim")
        void carriesIdentity() {
            Claims claims = service.validateToken(service.generateToken(7L, "Ada"));

            assertEquals("7", claims.getSubject());
            assertEquals("Ada", claims.get(JwtTokenService.NAME_CLAIM, String.class));
            assertNotNull(claims.getIssuedAt());
        }

        @Test
        @DisplayName("expiration honours the configured lifetime")
        void expiration() {
            Claims claims = service.validateToken(service.generateToken(7L, null));

            long lifetime = claims.getExpiration().getTime() - claims.getIssuedAt().getTime();
            assertEquals(EXPIRATION_SECONDS * 1000L, lifetime);
        }
    }

    @Nested
    @DisplayName("validateToken")
    class ValidateTokenTests {

        @Test
        @DisplayName("rejects a token signed with another secret")
        void rejectsForeignSignature() {
            var other = new JwtTokenService("another-secret-that-is-also-32-bytes-or-more", EXPIRATION_SECONDS);
            String token = other.generateToken(7L, "Ada");

            assertThrows(SignatureException.class, () -> service.validateToken(token));
        }

        @Test
        @DisplayName("rejects an expired token")
        void rejectsExpired() {
            var shortLived = new JwtTokenService(SECRET, -10);
            String token = shortLived.generateToken(7L, "Ada");

            assertThrows(ExpiredJwtException.class, () -> service.validateToken(token));
        }

        @Test
        @DisplayName("rejects garbage")
        void rejectsGarbage() {
            assertThrows(JwtException.class, () -> service.validateToken("not.a.jwt"));
        }
    }
}
