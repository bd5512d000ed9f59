package com.handyhub.bookingservice.security;

import com.handyhub.bookingservice.exception.UnauthorizedException;
import com.handyhub.bookingservice.model.CallerRole;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JwtIdentityVerifierTest {

    private static final String SECRET = "unit-test-secret-0123456789-abcdefghij";

    private final JwtIdentityVerifier verifier = new JwtIdentityVerifier(SECRET);

    static String token(String secret, String subject, String role, Date expiration) {
        JwtBuilder builder = Jwts.builder()
                .subject(subject)
                .issuedAt(new Date())
                .expiration(expiration)
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)));
        if (role != null) {
            builder.claim("role", role);
        }
        return builder.compact();
    }

    private static Date inOneHour() {
        return new Date(System.currentTimeMillis() + 3_600_000L);
    }

    @Test
    void acceptsSignedTokenWithRole() {
        CallerIdentity caller = verifier.verify(token(SECRET, "uid-7", "provider", inOneHour()));

        assertThat(caller.uid()).isEqualTo("uid-7");
        assertThat(caller.role()).isEqualTo(CallerRole.PROVIDER);
    }

    @Test
    void rejectsTokenSignedWithAnotherKey() {
        String forged = token("another-secret-0123456789-abcdefghijkl", "uid-7", "admin", inOneHour());

        assertThrows(UnauthorizedException.class, () -> verifier.verify(forged));
    }

    @Test
    void rejectsExpiredToken() {
        String expired = token(SECRET, "uid-7", "client", new Date(System.currentTimeMillis() - 60_000L));

        assertThrows(UnauthorizedException.class, () -> verifier.verify(expired));
    }

    @Test
    void rejectsUnknownOrMissingRole() {
        assertThrows(UnauthorizedException.class, () -> verifier.verify(token(SECRET, "uid-7", "janitor", inOneHour())));
        assertThrows(UnauthorizedException.class, () -> verifier.verify(token(SECRET, "uid-7", null, inOneHour())));
    }

    @Test
    void rejectsGarbageAndBlank() {
        assertThrows(UnauthorizedException.class, () -> verifier.verify("not-a-jwt"));
        assertThrows(UnauthorizedException.class, () -> verifier.verify(" "));
    }

    @Test
    void shortSecretFailsAtStartup() {
        assertThrows(IllegalStateException.class, () -> new JwtIdentityVerifier("too-short"));
    }
}
