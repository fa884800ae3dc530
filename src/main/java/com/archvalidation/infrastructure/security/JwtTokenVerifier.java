package com.archvalidation.infrastructure.security;

import com.archvalidation.config.ValidationProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.util.Date;

/**
 * Verifies HS256 bearer tokens and extracts the caller's identity.
 *
 * <p>Required claims: {@code user_id}, {@code tenant_id}, {@code exp}.
 * {@code role} is optional and defaults to Viewer.
 */
@Component
@Slf4j
public class JwtTokenVerifier {

    static final String USER_ID_CLAIM = "user_id";
    static final String TENANT_ID_CLAIM = "tenant_id";
    static final String ROLE_CLAIM = "role";

    private static final int MIN_SECRET_BYTES = 32;

    private final Key key;
    private final long clockSkewSeconds;
    private final Clock clock;

    public JwtTokenVerifier(ValidationProperties properties, Clock clock) {
        byte[] secret = properties.getSecurity().getJwtSecret().getBytes(StandardCharsets.UTF_8);
        if (secret.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                "validation.security.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = Keys.hmacShaKeyFor(secret);
        this.clockSkewSeconds = properties.getSecurity().getClockSkew().toSeconds();
        this.clock = clock;
        log.info("JWT verifier initialized: algorithm=HS256, clockSkew={}s", clockSkewSeconds);
    }

    /**
     * Verify a compact token.
     *
     * @throws BadCredentialsException if the token is malformed, badly signed, expired, or lacks a required claim
     */
    public AuthenticatedUser verify(String token) {
        if (token == null || token.isBlank()) {
            throw new BadCredentialsException("Bearer token is empty");
        }

        Jws<Claims> jws;
        try {
            jws = Jwts.parserBuilder()
                .setSigningKey(key)
                .setAllowedClockSkewSeconds(clockSkewSeconds)
                .setClock(() -> Date.from(clock.instant()))
                .build()
                .parseClaimsJws(token);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("JWT validation failed: {}", e.getMessage());
            throw new BadCredentialsException("Invalid or expired token", e);
        }

        if (!SignatureAlgorithm.HS256.getValue().equals(jws.getHeader().getAlgorithm())) {
            throw new BadCredentialsException("Unsupported token algorithm");
        }

        Claims claims = jws.getBody();
        if (claims.getExpiration() == null) {
            throw new BadCredentialsException("Token has no expiry");
        }
        String userId = stringClaim(claims, USER_ID_CLAIM);
        String tenantId = stringClaim(claims, TENANT_ID_CLAIM);
        if (userId == null || tenantId == null) {
            throw new BadCredentialsException("Token lacks user or tenant claim");
        }

        Role role = Role.fromClaim(stringClaim(claims, ROLE_CLAIM));
        return new AuthenticatedUser(userId, tenantId, role, claims.getExpiration().toInstant());
    }

    private static String stringClaim(Claims claims, String name) {
        Object value = claims.get(name);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }
}
