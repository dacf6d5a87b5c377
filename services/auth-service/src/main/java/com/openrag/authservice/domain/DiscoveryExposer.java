package com.openrag.authservice.domain;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.openrag.security.SessionClaims;
import com.openrag.security.SessionManager;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * OIDC-style discovery document, JWKS and token introspection, all derived from the {@link
 * SessionManager} key state. OpenSearch uses these to validate session tokens as it would tokens
 * from any OpenID provider.
 */
public class DiscoveryExposer {

    static final List<String> CLAIMS_SUPPORTED = List.of(
            "sub", "iss", "aud", "exp", "iat", "auth_time",
            "email", "email_verified", "name", "preferred_username");

    private final SessionManager sessionManager;
    private final String publicBaseUrl;

    /**
     * @param publicBaseUrl externally visible base URL; when null the caller's request base URL is
     *     used for each document. When set, the advertised issuer is the token issuer so relying
     *     parties can match {@code iss}.
     */
    public DiscoveryExposer(SessionManager sessionManager, String publicBaseUrl) {
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.publicBaseUrl = publicBaseUrl == null || publicBaseUrl.isBlank()
                ? null : stripTrailingSlash(publicBaseUrl);
    }

    public Map<String, Object> openIdConfiguration(String requestBaseUrl) {
        String base = publicBaseUrl != null ? publicBaseUrl : stripTrailingSlash(requestBaseUrl);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("issuer", publicBaseUrl != null ? sessionManager.issuer() : base);
        document.put("authorization_endpoint", base + "/auth/init");
        document.put("token_endpoint", base + "/auth/callback");
        document.put("jwks_uri", base + "/auth/jwks");
        document.put("userinfo_endpoint", base + "/auth/me");
        document.put("response_types_supported", List.of("code"));
        document.put("subject_types_supported", List.of("public"));
        document.put("id_token_signing_alg_values_supported", List.of(sessionManager.algorithm()));
        document.put("scopes_supported", List.of("openid", "email", "profile"));
        document.put("token_endpoint_auth_methods_supported", List.of("client_secret_basic"));
        document.put("claims_supported", CLAIMS_SUPPORTED);
        return document;
    }

    /** One RSA signing key, or an empty key set when tokens are signed with a shared secret. */
    public Map<String, Object> jwks() {
        List<Map<String, Object>> keys = sessionManager.rsaPublicKey()
                .map(publicKey -> new RSAKey.Builder(publicKey)
                        .keyUse(KeyUse.SIGNATURE)
                        .algorithm(JWSAlgorithm.RS256)
                        .keyID(sessionManager.keyId())
                        .build()
                        .toJSONObject())
                .map(List::of)
                .orElse(List.of());
        return Map.of("keys", keys);
    }

    /**
     * RFC 7662-style introspection. Never fails: anything that is not a valid token is reported as
     * inactive.
     */
    public Map<String, Object> introspect(String token) {
        Optional<SessionClaims> verified = sessionManager.verifyToken(token);
        if (verified.isEmpty()) {
            return Map.of("active", false);
        }
        SessionClaims claims = verified.get();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("active", true);
        response.put("sub", claims.sub());
        response.put("aud", claims.aud());
        response.put("iss", claims.iss());
        response.put("exp", claims.exp().getEpochSecond());
        response.put("iat", claims.iat().getEpochSecond());
        response.put("email", claims.email());
        response.put("name", claims.name());
        response.put("preferred_username", claims.preferredUsername());
        return response;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
