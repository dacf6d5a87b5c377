package com.openrag.security;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Authenticated caller, resolved from a session token, an API key or an OAuth login.
 * <p>
 * Immutable snapshot for one request; this core never persists users.
 *
 * @param userId   stable identifier (the token {@code sub} claim)
 * @param email    email address
 * @param name     display name
 * @param picture  avatar URL from the identity provider (nullable)
 * @param provider where the identity came from: {@code google}, {@code api_key}, {@code none}
 * @param roles    RBAC roles
 * @param groups   RBAC groups
 */
public record User(
        String userId,
        String email,
        String name,
        String picture,
        String provider,
        Set<String> roles,
        Set<String> groups
) {

    /** Fixed user ID of the no-auth identity. */
    public static final String ANONYMOUS_USER_ID = "anonymous";

    private static final User ANONYMOUS = new User(
            ANONYMOUS_USER_ID, "anonymous@localhost", "Anonymous User", null, "none", Set.of(), Set.of());

    public User {
        Objects.requireNonNull(userId, "userId");
        if (userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        groups = groups == null ? Set.of() : Set.copyOf(groups);
    }

    /**
     * The identity substituted in no-auth mode so downstream code never has to handle
     * an absent user.
     */
    public static User anonymous() {
        return ANONYMOUS;
    }

    /** A user signed in through an OAuth identity provider, with no RBAC attributes yet. */
    public static User of(String userId, String email, String name, String picture, String provider) {
        return new User(userId, email, name, picture, provider, Set.of(), Set.of());
    }

    public boolean isAnonymous() {
        return ANONYMOUS_USER_ID.equals(userId);
    }

    /** Returns a copy carrying the given RBAC attributes. */
    public User withAccess(Collection<String> newRoles, Collection<String> newGroups) {
        return new User(userId, email, name, picture, provider,
                newRoles == null ? Set.of() : Set.copyOf(newRoles),
                newGroups == null ? Set.of() : Set.copyOf(newGroups));
    }
}
