package com.skillswap.backend.security;

import com.skillswap.backend.exception.InvalidTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;

/**
 * Issues and verifies stateless bearer tokens. The payload carries only the
 * username (subject) and the expiry; there is no server-side revocation.
 */
@Slf4j
@Component
public class JwtService {
    private final JwtProperties properties;
    private final Key signingKey;

    public JwtService(JwtProperties properties) {
        this.properties = properties;
        this.signingKey = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(String username) {
        Date issuedAt = new Date();
        Date expiresAt = new Date(issuedAt.getTime() + properties.expiration());

        return Jwts.builder()
                .setSubject(username)
                .setIssuedAt(issuedAt)
                .setExpiration(expiresAt)
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Verify signature and expiry.
     *
     * @throws InvalidTokenException when the token is malformed, tampered or expired
     */
    public AuthenticatedUser verifyToken(String token) {
        try {
            Claims claims = extractAllClaims(token);
            String username = claims.getSubject();
            if (username == null || username.isBlank()) {
                throw new InvalidTokenException("invalid token data");
            }
            return new AuthenticatedUser(username);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new InvalidTokenException("invalid token data");
        }
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .build()
                .parseClaimsJws(token)
                .getBody();
    }
}
