package com.handyhub.bookingservice.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;

/**
 * Authenticates the external scheduler on the batch endpoints with the shared secret, sent
 * either as {@code x-cron-secret} or as {@code Authorization: Bearer <secret>}. Without a
 * configured secret no request is authenticated and the endpoints stay closed.
 */
@Component
public class CronSecretFilter extends OncePerRequestFilter {

    public static final String CRON_PATH_PREFIX = "/api/cron/";
    public static final String SCHEDULER_AUTHORITY = "ROLE_SCHEDULER";
    static final String SECRET_HEADER = "x-cron-secret";

    private static final Logger logger = LoggerFactory.getLogger(CronSecretFilter.class);

    private final String secret;

    public CronSecretFilter(@Value("${booking.cron.secret:}") String secret) {
        this.secret = secret == null ? "" : secret.trim();
        if (this.secret.isEmpty()) {
            logger.warn("[CronSecretFilter] booking.cron.secret is not set; batch endpoints will reject every call");
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !request.getRequestURI().startsWith(CRON_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        if (!secret.isEmpty() && matches(presentedSecret(request))) {
            UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                    "scheduler",
                    null,
                    Collections.singletonList(new SimpleGrantedAuthority(SCHEDULER_AUTHORITY)));
            SecurityContextHolder.getContext().setAuthentication(authToken);
        } else {
            logger.warn("[CronSecretFilter] Rejected batch call to {}", request.getRequestURI());
        }
        filterChain.doFilter(request, response);
    }

    private String presentedSecret(HttpServletRequest request) {
        String header = request.getHeader(SECRET_HEADER);
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        String authorization = request.getHeader("Authorization");
        if (authorization != null && authorization.startsWith("Bearer ")) {
            return authorization.substring(7).trim();
        }
        return null;
    }

    private boolean matches(String presented) {
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                secret.getBytes(StandardCharsets.UTF_8));
    }
}
