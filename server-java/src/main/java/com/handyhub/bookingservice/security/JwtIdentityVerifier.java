package com.handyhub.bookingservice.security;

import com.handyhub.bookingservice.exception.UnauthorizedException;
import com.handyhub.bookingservice.model.CallerRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Verifies HS256 tokens issued by the identity provider. The subject is the caller uid and the
 * {@code role} claim one of client, provider, contractor, admin.
 */
@Component
public class JwtIdentityVerifier implements IdentityVerifier {

    private static final Logger logger = LoggerFactory.getLogger(JwtIdentityVerifier.class);
    static final String CLAIM_ROLE = "role";

    private final SecretKey secretKey;

    public JwtIdentityVerifier(@Value("${auth.jwt.secret}") String secret) {
        if (secret == null || secret.length() < 32) {
            throw new IllegalStateException("auth.jwt.secret must be at least 32 characters for HS256");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public CallerIdentity verify(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new UnauthorizedException("Missing auth token");
        }
        Claims claims;
        try {
            claims = Jwts.parser().verifyWith(secretKey).build().parseSignedClaims(bearerToken).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            logger.debug("[JwtIdentityVerifier] Token rejected: {}", e.getMessage());
            throw new UnauthorizedException("Invalid or expired auth token");
        }
        String uid = claims.getSubject();
        if (uid == null || uid.isBlank()) {
            throw new UnauthorizedException("Auth token has no subject");
        }
        CallerRole role = CallerRole.parse(claims.get(CLAIM_ROLE, String.class));
        if (role == null) {
            throw new UnauthorizedException("Auth token carries no known role");
        }
        return new CallerIdentity(uid, role);
    }
}
