package com.openrag.authservice.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Known connector types and their OAuth client registrations.
 *
 * <p>Built-in endpoints and scopes exist for {@code google_drive}, {@code onedrive} and {@code
 * sharepoint}; configuration supplies the client credentials and may override the rest.
 */
public final class OAuthProviderRegistry {

    public static final String GOOGLE_DRIVE = "google_drive";
    public static final String ONEDRIVE = "onedrive";
    public static final String SHAREPOINT = "sharepoint";

    private static final String MICROSOFT_AUTHORIZE =
            "https://login.microsoftonline.com/common/oauth2/v2.0/authorize";
    private static final String MICROSOFT_TOKEN =
            "https://login.microsoftonline.com/common/oauth2/v2.0/token";
    private static final List<String> MICROSOFT_SCOPES =
            List.of("offline_access", "User.Read", "Files.Read", "Files.Read.All");

    private static final Map<String, OAuthProvider> BUILT_IN = Map.of(
            GOOGLE_DRIVE,
            new OAuthProvider(
                    GOOGLE_DRIVE,
                    null,
                    null,
                    "https://accounts.google.com/o/oauth2/v2/auth",
                    "https://oauth2.googleapis.com/token",
                    "https://www.googleapis.com/oauth2/v3/userinfo",
                    List.of("openid", "email", "profile",
                            "https://www.googleapis.com/auth/drive.readonly")),
            ONEDRIVE,
            new OAuthProvider(ONEDRIVE, null, null, MICROSOFT_AUTHORIZE, MICROSOFT_TOKEN,
                    "https://graph.microsoft.com/oidc/userinfo", MICROSOFT_SCOPES),
            SHAREPOINT,
            new OAuthProvider(SHAREPOINT, null, null, MICROSOFT_AUTHORIZE, MICROSOFT_TOKEN,
                    "https://graph.microsoft.com/oidc/userinfo", MICROSOFT_SCOPES));

    private final Map<String, OAuthProvider> providers;

    public OAuthProviderRegistry(Map<String, OAuthProvider> providers) {
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }

    /**
     * Built-in providers with the given registrations applied on top. Registrations for connector
     * types without built-in defaults must carry their own endpoints.
     */
    public static OAuthProviderRegistry withDefaults(Map<String, OAuthProvider> configured) {
        Map<String, OAuthProvider> merged = new LinkedHashMap<>(BUILT_IN);
        configured.forEach((type, registration) -> {
            OAuthProvider base = merged.get(type);
            merged.put(type, base == null
                    ? registration
                    : base.withOverrides(
                            registration.clientId(),
                            registration.clientSecret(),
                            registration.authorizationEndpoint(),
                            registration.tokenEndpoint(),
                            registration.userinfoEndpoint(),
                            registration.scopes()));
        });
        return new OAuthProviderRegistry(merged);
    }

    /** Built-in defaults for {@code connectorType}, or empty for unknown types. */
    public static Optional<OAuthProvider> builtIn(String connectorType) {
        return Optional.ofNullable(BUILT_IN.get(connectorType));
    }

    public Optional<OAuthProvider> find(String connectorType) {
        return Optional.ofNullable(connectorType).map(providers::get);
    }

    public Set<String> connectorTypes() {
        return providers.keySet();
    }
}
