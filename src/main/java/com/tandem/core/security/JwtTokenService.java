package com.tandem.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Signs and verifies actor tokens. Issuance exists for the CLI and for tests; in
 * production tokens come from the identity provider sharing the same secret.
 */
@Service
public class JwtTokenService {

    static final String NAME_CLAIM = "name";

    private final SecretKey signingKey;
    private final int expirationSeconds;

    @Autowired
    public JwtTokenService(SecurityProperties securityProperties) {
        this(securityProperties.getJwt().getSecret(), securityProperties.getJwt().getExpirationSeconds());
    }

    JwtTokenService(String secret, int expirationSeconds) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationSeconds = expirationSeconds;
    }

    public String generateToken(long userId, String displayName) {
        Date now = new Date();
        Date expiration = new Date(now.getTime() + expirationSeconds * 1000L);

        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(NAME_CLAIM, displayName)
                .issuedAt(now)
                .expiration(expiration)
                .signWith(signingKey)
                .compact();
    }

    /**
     * @throws io.jsonwebtoken.JwtException if the token is malformed, expired or badly signed
     */
    public Claims validateToken(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
