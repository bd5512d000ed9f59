package com.handyhub.bookingservice.security;

import com.handyhub.bookingservice.exception.UnauthorizedException;
import com.handyhub.bookingservice.model.CallerRole;
import org.springframework.security.core.AuthenticatedPrincipal;
import org.springframework.security.core.Authentication;

/**
 * Who is calling, as vouched for by the identity provider.
 */
public record CallerIdentity(String uid, CallerRole role) implements AuthenticatedPrincipal {

    @Override
    public String getName() {
        return uid;
    }

    public boolean hasRole(CallerRole expected) {
        return role == expected;
    }

    public static CallerIdentity from(Authentication authentication) {
        if (authentication != null && authentication.getPrincipal() instanceof CallerIdentity caller) {
            return caller;
        }
        throw new UnauthorizedException("Authentication required");
    }
}
