package com.openrag.authservice.domain;

/** Exchanges an authorization code at the provider's token endpoint. */
@FunctionalInterface
public interface OAuthTokenExchanger {

    /**
     * @throws RuntimeException on any provider or transport failure
     */
    OAuthTokens exchange(OAuthProvider provider, String authorizationCode, String redirectUri);
}
