package com.openrag.security;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Owner and access scope of a valid API key.
 *
 * @param keyId     stored key identifier (never the key itself)
 * @param userId    user the key was created for
 * @param userEmail that user's email
 * @param name      display name, defaults to {@code API User}
 * @param roles     roles granted to the key, defaults to {@code [openrag_user]}
 * @param groups    groups granted to the key
 */
public record ApiKeyPrincipal(
        String keyId,
        String userId,
        String userEmail,
        String name,
        List<String> roles,
        List<String> groups
) {

    public ApiKeyPrincipal {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(userId, "userId");
        if (name == null || name.isBlank()) {
            name = "API User";
        }
        roles = roles == null || roles.isEmpty() ? List.of(SessionManager.DEFAULT_ROLE) : List.copyOf(roles);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    /** The request-scoped user acting through this key, restricted to the key's roles and groups. */
    public User toUser() {
        return new User(userId, userEmail, name, null, "api_key", Set.copyOf(roles), Set.copyOf(groups));
    }
}
