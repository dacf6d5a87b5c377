package com.openrag.authservice.infrastructure.oauth;

import com.openrag.authservice.domain.OAuthProvider;
import com.openrag.authservice.domain.OAuthTokens;
import com.openrag.authservice.domain.ProviderIdentityResolver;
import com.openrag.security.User;
import java.util.Map;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;

/**
 * Resolves the signed-in user from an OpenID Connect userinfo endpoint.
 *
 * <p>The provider's {@code sub} becomes the user id; {@code email}, {@code name} and {@code
 * picture} are copied when present.
 */
public class UserInfoIdentityResolver implements ProviderIdentityResolver {

    static final String GOOGLE_PROVIDER = "google";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public UserInfoIdentityResolver(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public User resolve(OAuthProvider provider, OAuthTokens tokens) {
        if (provider.userinfoEndpoint() == null) {
            throw new IllegalStateException("No userinfo endpoint for " + provider.connectorType());
        }
        Map<String, Object> userInfo = restClient.get()
                .uri(provider.userinfoEndpoint())
                .headers(headers -> headers.setBearerAuth(tokens.accessToken()))
                .retrieve()
                .body(JSON_OBJECT);
        if (userInfo == null || !(userInfo.get("sub") instanceof String subject) || subject.isBlank()) {
            throw new IllegalStateException("userinfo response carried no subject");
        }
        return User.of(
                subject,
                string(userInfo, "email"),
                string(userInfo, "name"),
                string(userInfo, "picture"),
                GOOGLE_PROVIDER);
    }

    private static String string(Map<String, Object> source, String key) {
        return source.get(key) instanceof String value ? value : null;
    }
}
