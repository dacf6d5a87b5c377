package com.openrag.authservice.domain;

import java.util.List;
import java.util.Objects;

/**
 * OAuth client registration for one connector type.
 *
 * @param connectorType connector type, e.g. {@code google_drive}
 * @param clientId OAuth client id
 * @param clientSecret OAuth client secret
 * @param authorizationEndpoint provider authorization endpoint
 * @param tokenEndpoint provider token endpoint
 * @param userinfoEndpoint provider userinfo endpoint, null when the provider is not used for login
 * @param scopes scopes requested at authorization
 */
public record OAuthProvider(
        String connectorType,
        String clientId,
        String clientSecret,
        String authorizationEndpoint,
        String tokenEndpoint,
        String userinfoEndpoint,
        List<String> scopes) {

    public OAuthProvider {
        Objects.requireNonNull(connectorType, "connectorType");
        Objects.requireNonNull(authorizationEndpoint, "authorizationEndpoint");
        Objects.requireNonNull(tokenEndpoint, "tokenEndpoint");
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public boolean hasCredentials() {
        return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
    }

    /** Copy with client credentials and any non-blank overrides applied. */
    public OAuthProvider withOverrides(
            String newClientId,
            String newClientSecret,
            String newAuthorizationEndpoint,
            String newTokenEndpoint,
            String newUserinfoEndpoint,
            List<String> newScopes) {
        return new OAuthProvider(
                connectorType,
                newClientId,
                newClientSecret,
                orElse(newAuthorizationEndpoint, authorizationEndpoint),
                orElse(newTokenEndpoint, tokenEndpoint),
                orElse(newUserinfoEndpoint, userinfoEndpoint),
                newScopes == null || newScopes.isEmpty() ? scopes : newScopes);
    }

    @Override
    public String toString() {
        return "OAuthProvider[connectorType=" + connectorType + ", clientId=" + clientId
                + ", authorizationEndpoint=" + authorizationEndpoint + ", scopes=" + scopes + "]";
    }

    private static String orElse(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
