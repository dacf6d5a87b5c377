package com.openrag.authservice.domain;

import java.util.List;

/**
 * Outcome of starting an OAuth connection.
 *
 * @param connectionId id the client sends back with the callback
 * @param authorizeUrl provider URL to send the browser to
 * @param clientConfig public OAuth client parameters for clients that build the URL themselves
 */
public record OAuthInitResult(String connectionId, String authorizeUrl, ClientConfig clientConfig) {

    /** Public (non-secret) OAuth client parameters. */
    public record ClientConfig(
            String clientId,
            List<String> scopes,
            String redirectUri,
            String authorizationEndpoint,
            String tokenEndpoint) {
    }
}
