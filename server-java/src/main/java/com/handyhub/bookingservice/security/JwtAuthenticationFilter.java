package com.handyhub.bookingservice.security;

import com.handyhub.bookingservice.exception.UnauthorizedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

/**
 * Resolves the bearer credential through {@link IdentityVerifier}. Requests without a valid
 * credential continue unauthenticated and are rejected by the entry point where
 * authentication is required.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityVerifier identityVerifier;

    public JwtAuthenticationFilter(IdentityVerifier identityVerifier) {
        this.identityVerifier = identityVerifier;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        // batch endpoints carry the shared cron secret, not a user token
        return request.getRequestURI().startsWith(CronSecretFilter.CRON_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        final String authHeader = request.getHeader("Authorization");
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            try {
                CallerIdentity caller = identityVerifier.verify(authHeader.substring(BEARER_PREFIX.length()).trim());
                UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                        caller,
                        null,
                        Collections.singletonList(new SimpleGrantedAuthority(caller.role().authority()))
                );
                authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authToken);
                logger.debug("[JwtAuthenticationFilter] Authenticated {} as {} for {}",
                        caller.uid(), caller.role(), request.getRequestURI());
            } catch (UnauthorizedException e) {
                logger.debug("[JwtAuthenticationFilter] {} on {}", e.getMessage(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
