package com.openrag.security;

import java.util.Optional;

/**
 * Checks a machine API key against the stored key records.
 * <p>
 * Owned by the API key store; the auth core only consumes it. Implementations may block on
 * their backing store and may throw. Callers treat a thrown exception exactly like an invalid
 * key: a failed lookup never authenticates anyone.
 */
@FunctionalInterface
public interface ApiKeyValidator {

    /**
     * @param apiKey full key including the {@code orag_} prefix
     * @return the key's owner and RBAC attributes, or empty when the key is unknown or revoked
     */
    Optional<ApiKeyPrincipal> validate(String apiKey);
}
