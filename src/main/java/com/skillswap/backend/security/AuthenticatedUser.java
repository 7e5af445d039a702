package com.skillswap.backend.security;

import com.skillswap.backend.exception.IdentityMismatchException;

/**
 * Identity verified from the bearer token, bound to the current request.
 * Controllers declare it as a parameter to receive the caller's identity.
 */
public record AuthenticatedUser(String username) {

    /**
     * Resolve the acting username for a request that may also name one explicitly.
     * A named user other than the token's identity is rejected.
     *
     * @param claimedUsername username supplied by the client, may be null
     * @return the authenticated username
     */
    public String actingAs(String claimedUsername) {
        if (claimedUsername != null && !claimedUsername.isBlank() && !claimedUsername.equals(username)) {
            throw new IdentityMismatchException(
                    "Authenticated as '" + username + "' but request acts as '" + claimedUsername + "'");
        }
        return username;
    }
}
