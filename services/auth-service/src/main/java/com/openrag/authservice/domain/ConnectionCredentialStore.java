package com.openrag.authservice.domain;

import java.util.Optional;

/**
 * Persists the provider credentials of a completed connection. Owned by the connector layer;
 * the flow only hands records over.
 */
public interface ConnectionCredentialStore {

    /**
     * A completed connection and its tokens.
     *
     * @param connection the consumed pending connection
     * @param tokens tokens from the provider
     * @param ownerUserId user the credentials belong to
     */
    record StoredCredential(PendingConnection connection, OAuthTokens tokens, String ownerUserId) {
    }

    void save(StoredCredential credential);

    Optional<StoredCredential> find(String connectionId);
}
