package com.openrag.security;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Verified claim set of a session token.
 * <p>
 * Only constructed by {@link SessionManager#verifyToken(String)} after the signature, expiry,
 * issuer and audience checks passed, so holding one means the token was valid when checked.
 *
 * @param sub               subject, the user ID
 * @param iss               issuer
 * @param aud               audiences
 * @param exp               expiry
 * @param iat               issued-at
 * @param email             email address
 * @param name              display name
 * @param preferredUsername preferred username (the email for OAuth logins)
 * @param provider          identity source recorded at issuance (nullable on foreign tokens)
 * @param roles             RBAC roles
 * @param groups            RBAC groups
 */
public record SessionClaims(
        String sub,
        String iss,
        List<String> aud,
        Instant exp,
        Instant iat,
        String email,
        String name,
        String preferredUsername,
        String provider,
        List<String> roles,
        List<String> groups
) {

    public SessionClaims {
        if (sub == null || sub.isBlank()) {
            throw new IllegalArgumentException("sub must not be null or blank");
        }
        Objects.requireNonNull(exp, "exp");
        Objects.requireNonNull(iat, "iat");
        if (!exp.isAfter(iat)) {
            throw new IllegalArgumentException("exp must be after iat");
        }
        aud = aud == null ? List.of() : List.copyOf(aud);
        roles = roles == null ? List.of() : List.copyOf(roles);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    /** Maps the claims to the request-scoped {@link User}. */
    public User toUser() {
        return new User(sub, email, name, null, provider != null ? provider : "google",
                Set.copyOf(roles), Set.copyOf(groups));
    }
}
