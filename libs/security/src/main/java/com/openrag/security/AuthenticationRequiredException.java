package com.openrag.security;

/**
 * A route that requires a browser session was called without a valid {@code auth_token} cookie.
 */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException() {
        super("Authentication required");
    }
}
