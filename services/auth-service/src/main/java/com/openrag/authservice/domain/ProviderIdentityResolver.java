package com.openrag.authservice.domain;

import com.openrag.security.User;

/** Looks up who signed in, using the provider's userinfo endpoint. */
@FunctionalInterface
public interface ProviderIdentityResolver {

    User resolve(OAuthProvider provider, OAuthTokens tokens);
}
