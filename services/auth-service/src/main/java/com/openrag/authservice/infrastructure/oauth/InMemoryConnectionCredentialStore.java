package com.openrag.authservice.infrastructure.oauth;

import com.openrag.authservice.domain.ConnectionCredentialStore;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Process-local credential store, used until a connector layer provides a persistent one. */
public class InMemoryConnectionCredentialStore implements ConnectionCredentialStore {

    private final ConcurrentMap<String, StoredCredential> credentials = new ConcurrentHashMap<>();

    @Override
    public void save(StoredCredential credential) {
        credentials.put(credential.connection().connectionId(), credential);
    }

    @Override
    public Optional<StoredCredential> find(String connectionId) {
        return Optional.ofNullable(credentials.get(connectionId));
    }
}
