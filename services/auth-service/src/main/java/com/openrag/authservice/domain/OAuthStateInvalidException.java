package com.openrag.authservice.domain;

/**
 * OAuth callback rejected before any provider call: the state did not match, the pending
 * connection expired, or it was already consumed.
 */
public class OAuthStateInvalidException extends RuntimeException {

    public OAuthStateInvalidException(String message) {
        super(message);
    }
}
