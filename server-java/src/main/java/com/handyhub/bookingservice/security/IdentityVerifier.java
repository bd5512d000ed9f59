package com.handyhub.bookingservice.security;

/**
 * Boundary to the external identity provider.
 */
public interface IdentityVerifier {

    /**
     * @param bearerToken the raw credential without the {@code Bearer } prefix
     * @return the verified caller
     * @throws com.handyhub.bookingservice.exception.UnauthorizedException if the credential is
     *         missing, malformed, expired or carries no known role
     */
    CallerIdentity verify(String bearerToken);
}
