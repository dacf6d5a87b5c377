package com.openrag.authservice.domain;

import java.util.List;
import java.util.Objects;

/**
 * Tokens returned by a provider's token endpoint.
 *
 * @param accessToken provider access token
 * @param refreshToken refresh token, null when the provider issued none
 * @param scopes granted scopes
 * @param expiresIn access token lifetime in seconds, null when unknown
 */
public record OAuthTokens(
        String accessToken, String refreshToken, List<String> scopes, Long expiresIn) {

    public OAuthTokens {
        Objects.requireNonNull(accessToken, "accessToken");
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    @Override
    public String toString() {
        return "OAuthTokens[scopes=" + scopes + ", expiresIn=" + expiresIn
                + ", refreshToken=" + (refreshToken != null ? "present" : "absent") + "]";
    }
}
