package com.openrag.authservice.config;

import com.openrag.security.SessionManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the auth service, bound from {@code openrag.auth.*}.
 *
 * <pre>
 * openrag:
 *   auth:
 *     issuer: https://openrag.example.com
 *     jwt:
 *       signing-key: ${JWT_SIGNING_KEY:}
 *     oauth:
 *       providers:
 *         "[google_drive]":
 *           client-id: ${GOOGLE_OAUTH_CLIENT_ID:}
 *           client-secret: ${GOOGLE_OAUTH_CLIENT_SECRET:}
 * </pre>
 *
 * <p>Compact constructors apply defaults before Bean Validation runs, so a minimal configuration
 * binds to a working service.
 *
 * @param issuer token {@code iss}; defaults to {@code publicBaseUrl} when that is set, otherwise
 *     {@link SessionManager#DEFAULT_ISSUER}
 * @param publicBaseUrl externally visible base URL for discovery; request base URL when blank
 * @param audiences token audiences
 * @param sessionLifetime browser session lifetime, also the cookie max-age
 * @param jwt signing key sources
 * @param cookie session cookie settings
 * @param oauth OAuth connection settings
 * @param transportPaths servlet paths guarded by the API key transport gate
 * @param apiKeys statically configured API keys (hashed)
 */
@ConfigurationProperties(prefix = "openrag.auth")
@Validated
public record AuthProperties(
        String issuer,
        String publicBaseUrl,
        List<String> audiences,
        Duration sessionLifetime,
        @Valid Jwt jwt,
        @Valid Cookie cookie,
        @Valid OAuth oauth,
        List<String> transportPaths,
        List<@Valid ApiKey> apiKeys) {

    /** Connector type whose credentials double as the application login. */
    public static final String APP_LOGIN_PROVIDER = "google_drive";

    public AuthProperties {
        if (issuer == null || issuer.isBlank()) {
            issuer = publicBaseUrl == null || publicBaseUrl.isBlank()
                    ? SessionManager.DEFAULT_ISSUER
                    : withoutTrailingSlash(publicBaseUrl);
        }
        audiences = audiences == null || audiences.isEmpty()
                ? SessionManager.DEFAULT_AUDIENCES : List.copyOf(audiences);
        if (sessionLifetime == null) {
            sessionLifetime = SessionManager.DEFAULT_SESSION_LIFETIME;
        }
        if (jwt == null) {
            jwt = new Jwt(null, null, null, null);
        }
        if (cookie == null) {
            cookie = new Cookie(null, null);
        }
        if (oauth == null) {
            oauth = new OAuth(null, null, null);
        }
        transportPaths = transportPaths == null || transportPaths.isEmpty()
                ? List.of("/mcp/*") : List.copyOf(transportPaths);
        apiKeys = apiKeys == null ? List.of() : List.copyOf(apiKeys);
    }

    /**
     * No-auth mode: the Google OAuth client is not fully configured, so nobody can sign in and
     * every request runs as the anonymous user.
     */
    public boolean noAuthMode() {
        Provider google = oauth.providers().get(APP_LOGIN_PROVIDER);
        return google == null || !google.hasCredentials();
    }

    private static String withoutTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * @param signingKey inline PKCS#8 PEM or HS256 secret ({@code JWT_SIGNING_KEY})
     * @param privateKeyPath RSA private key file
     * @param publicKeyPath RSA public key file
     * @param generateIfMissing write a fresh key pair when neither file exists
     */
    public record Jwt(
            String signingKey, Path privateKeyPath, Path publicKeyPath, Boolean generateIfMissing) {

        public Jwt {
            if (privateKeyPath == null) {
                privateKeyPath = Path.of("keys", "private_key.pem");
            }
            if (publicKeyPath == null) {
                publicKeyPath = Path.of("keys", "public_key.pem");
            }
            if (generateIfMissing == null) {
                generateIfMissing = Boolean.TRUE;
            }
        }
    }

    /**
     * @param name cookie name
     * @param secure whether to set the {@code Secure} attribute
     */
    public record Cookie(String name, Boolean secure) {

        public Cookie {
            if (name == null || name.isBlank()) {
                name = "auth_token";
            }
            if (secure == null) {
                secure = Boolean.FALSE;
            }
        }
    }

    /**
     * @param stateTtl how long a pending connection waits for its callback
     * @param webhookBaseUrl base URL for provider change notifications (optional)
     * @param providers provider registrations keyed by connector type
     */
    public record OAuth(Duration stateTtl, String webhookBaseUrl, Map<String, @Valid Provider> providers) {

        public OAuth {
            if (stateTtl == null || stateTtl.isNegative() || stateTtl.isZero()) {
                stateTtl = Duration.ofMinutes(10);
            }
            if (webhookBaseUrl != null && webhookBaseUrl.isBlank()) {
                webhookBaseUrl = null;
            }
            providers = providers == null ? Map.of() : new LinkedHashMap<>(providers);
        }
    }

    /**
     * One OAuth client registration. Endpoints and scopes left blank fall back to the built-in
     * defaults for the connector type.
     */
    public record Provider(
            String clientId,
            String clientSecret,
            String authorizationEndpoint,
            String tokenEndpoint,
            String userinfoEndpoint,
            List<String> scopes) {

        public Provider {
            scopes = scopes == null ? List.of() : List.copyOf(scopes);
        }

        public boolean hasCredentials() {
            return clientId != null && !clientId.isBlank()
                    && clientSecret != null && !clientSecret.isBlank();
        }

        /** True when exactly one of client id and secret is set. */
        public boolean isHalfConfigured() {
            boolean hasId = clientId != null && !clientId.isBlank();
            boolean hasSecret = clientSecret != null && !clientSecret.isBlank();
            return hasId != hasSecret;
        }
    }

    /**
     * A statically provisioned API key. Only the SHA-256 hex digest of the key is configured.
     *
     * @param keyId identifier shown in logs
     * @param keyHash lowercase hex SHA-256 of the full {@code orag_} key
     * @param userId owning user
     * @param userEmail owner's email
     * @param name display name
     * @param roles roles granted to the key
     * @param groups groups granted to the key
     */
    public record ApiKey(
            @NotBlank String keyId,
            @NotBlank String keyHash,
            @NotBlank String userId,
            String userEmail,
            String name,
            List<String> roles,
            List<String> groups) {
    }
}
