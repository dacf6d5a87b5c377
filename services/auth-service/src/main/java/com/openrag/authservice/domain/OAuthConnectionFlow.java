package com.openrag.authservice.domain;

import com.openrag.security.AuthConfigurationException;
import com.openrag.security.SessionManager;
import com.openrag.security.User;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Init and callback lifecycle of OAuth connections, for application login and data-source links.
 *
 * <p>{@link #init} records a pending connection bound to a random state nonce and returns the
 * provider authorization URL. {@link #callback} checks the state before anything else: a missing,
 * mismatched, expired or already used state is rejected without contacting the provider. A
 * mismatch leaves the pending connection in place, so a forged callback cannot cancel a genuine
 * one; expiry removes it; success consumes it atomically, so a replay fails.
 */
public class OAuthConnectionFlow {

    private static final Logger log = LoggerFactory.getLogger(OAuthConnectionFlow.class);

    private static final int STATE_NONCE_BYTES = 32;

    /**
     * Flow settings.
     *
     * @param stateTtl lifetime of a pending connection
     * @param webhookBaseUrl base URL for connector change notifications, null when not configured
     * @param noAuthMode whether authentication is disabled for this deployment
     */
    public record Settings(Duration stateTtl, String webhookBaseUrl, boolean noAuthMode) {

        public Settings {
            if (stateTtl == null || stateTtl.isZero() || stateTtl.isNegative()) {
                stateTtl = Duration.ofMinutes(10);
            }
        }
    }

    private final OAuthProviderRegistry providers;
    private final PendingConnectionStore pendingConnections;
    private final OAuthTokenExchanger tokenExchanger;
    private final ProviderIdentityResolver identityResolver;
    private final ConnectionCredentialStore credentialStore;
    private final SessionManager sessionManager;
    private final Settings settings;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public OAuthConnectionFlow(
            OAuthProviderRegistry providers,
            PendingConnectionStore pendingConnections,
            OAuthTokenExchanger tokenExchanger,
            ProviderIdentityResolver identityResolver,
            ConnectionCredentialStore credentialStore,
            SessionManager sessionManager,
            Settings settings,
            Clock clock) {
        this.providers = Objects.requireNonNull(providers, "providers");
        this.pendingConnections = Objects.requireNonNull(pendingConnections, "pendingConnections");
        this.tokenExchanger = Objects.requireNonNull(tokenExchanger, "tokenExchanger");
        this.identityResolver = Objects.requireNonNull(identityResolver, "identityResolver");
        this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore");
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts a connection.
     *
     * @param connectorType provider connector type
     * @param purpose {@code app_auth} or {@code data_source}
     * @param connectionName display name, defaults to {@code <connectorType>_<purpose>}
     * @param redirectUri where the provider sends the browser back to
     * @param userId user starting the flow, null when anonymous
     * @throws AuthConfigurationException in no-auth mode or when the provider has no client
     *     credentials
     * @throws IllegalArgumentException for unsupported purposes or connector types, or a missing
     *     redirect URI
     */
    public OAuthInitResult init(
            String connectorType, String purpose, String connectionName, String redirectUri, String userId) {
        if (settings.noAuthMode()) {
            throw new AuthConfigurationException(
                    "OAuth credentials not configured. Set GOOGLE_OAUTH_CLIENT_ID and "
                            + "GOOGLE_OAUTH_CLIENT_SECRET to enable authentication.");
        }
        OAuthPurpose resolvedPurpose = OAuthPurpose.fromWireName(purpose)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported purpose: " + purpose));
        if (resolvedPurpose == OAuthPurpose.APP_AUTH
                && !OAuthProviderRegistry.GOOGLE_DRIVE.equals(connectorType)) {
            throw new IllegalArgumentException("Only Google login supported for app authentication");
        }
        OAuthProvider provider = providers.find(connectorType)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported connector type: " + connectorType));
        if (redirectUri == null || redirectUri.isBlank()) {
            throw new IllegalArgumentException("redirect_uri is required");
        }
        if (!provider.hasCredentials()) {
            throw new AuthConfigurationException(
                    "OAuth client credentials are not configured for " + connectorType);
        }

        Instant now = clock.instant();
        int purged = pendingConnections.purgeExpired(now);
        if (purged > 0) {
            log.debug("Purged {} expired pending OAuth connections", purged);
        }

        String name = connectionName == null || connectionName.isBlank()
                ? connectorType + "_" + resolvedPurpose.wireName()
                : connectionName;
        String webhookUrl = settings.webhookBaseUrl() != null
                ? stripTrailingSlash(settings.webhookBaseUrl()) + "/connectors/" + connectorType + "/webhook"
                : null;
        PendingConnection pending = new PendingConnection(
                UUID.randomUUID().toString(),
                connectorType,
                resolvedPurpose,
                name,
                redirectUri,
                newStateNonce(),
                userId,
                webhookUrl,
                now,
                now.plus(settings.stateTtl()));
        pendingConnections.put(pending);

        log.info("OAuth {} flow started for connector {} (connection {})",
                resolvedPurpose.wireName(), connectorType, pending.connectionId());
        return new OAuthInitResult(
                pending.connectionId(),
                authorizeUrl(provider, pending),
                new OAuthInitResult.ClientConfig(
                        provider.clientId(),
                        provider.scopes(),
                        redirectUri,
                        provider.authorizationEndpoint(),
                        provider.tokenEndpoint()));
    }

    /**
     * Completes a connection.
     *
     * @throws IllegalArgumentException when connection id or code is missing
     * @throws OAuthStateInvalidException when the state is missing, wrong, expired or used
     * @throws OAuthExchangeFailedException when the provider fails
     */
    public OAuthCallbackResult callback(String connectionId, String authorizationCode, String state) {
        if (connectionId == null || connectionId.isBlank()
                || authorizationCode == null || authorizationCode.isBlank()) {
            throw new IllegalArgumentException(
                    "Missing required parameters (connection_id, authorization_code)");
        }
        PendingConnection pending = pendingConnections.find(connectionId)
                .orElseThrow(() -> new OAuthStateInvalidException("Unknown or already completed connection"));

        if (pending.isExpired(clock.instant())) {
            pendingConnections.consume(pending);
            log.info("Rejected OAuth callback for expired connection {}", connectionId);
            throw new OAuthStateInvalidException("OAuth state expired");
        }
        if (!stateMatches(pending.stateNonce(), state)) {
            log.warn("Rejected OAuth callback with mismatched state for connection {}", connectionId);
            throw new OAuthStateInvalidException("OAuth state mismatch");
        }
        if (!pendingConnections.consume(pending)) {
            throw new OAuthStateInvalidException("Unknown or already completed connection");
        }

        OAuthProvider provider = providers.find(pending.connectorType())
                .orElseThrow(() -> new AuthConfigurationException(
                        "No OAuth provider registered for " + pending.connectorType()));
        OAuthTokens tokens = exchange(provider, pending, authorizationCode);

        if (pending.purpose() == OAuthPurpose.DATA_SOURCE) {
            credentialStore.save(new ConnectionCredentialStore.StoredCredential(pending, tokens, pending.ownerUserId()));
            log.info("Data source connection {} authenticated for connector {}",
                    pending.connectionId(), pending.connectorType());
            return new OAuthCallbackResult(
                    pending.connectionId(), pending.purpose(), pending.connectorType(), pending.ownerUserId(),
                    null, null);
        }

        User user = resolveIdentity(provider, pending, tokens);
        PendingConnection drive = pending.asDataSource(
                "Google Drive (" + (user.email() != null ? user.email() : "Unknown") + ")", user.userId());
        credentialStore.save(new ConnectionCredentialStore.StoredCredential(drive, tokens, user.userId()));
        String sessionToken = sessionManager.issueToken(user);
        log.info("User {} signed in through {}; connection {} kept as a data source",
                user.userId(), pending.connectorType(), pending.connectionId());
        return new OAuthCallbackResult(pending.connectionId(), pending.purpose(), pending.connectorType(),
                user.userId(), sessionToken, drive.connectionId());
    }

    private OAuthTokens exchange(OAuthProvider provider, PendingConnection pending, String authorizationCode) {
        try {
            OAuthTokens tokens = tokenExchanger.exchange(provider, authorizationCode, pending.redirectUri());
            if (tokens == null) {
                throw new IllegalStateException("token endpoint returned no tokens");
            }
            return tokens;
        } catch (RuntimeException e) {
            log.warn("OAuth code exchange failed for connection {}: {}", pending.connectionId(), e.toString());
            throw new OAuthExchangeFailedException(
                    pending.connectorType(), "OAuth token exchange failed", e);
        }
    }

    private User resolveIdentity(OAuthProvider provider, PendingConnection pending, OAuthTokens tokens) {
        try {
            User user = identityResolver.resolve(provider, tokens);
            if (user == null) {
                throw new IllegalStateException("provider returned no identity");
            }
            return user;
        } catch (RuntimeException e) {
            log.warn("Identity lookup failed for connection {}: {}", pending.connectionId(), e.toString());
            throw new OAuthExchangeFailedException(
                    pending.connectorType(), "Failed to resolve user identity", e);
        }
    }

    private String newStateNonce() {
        byte[] bytes = new byte[STATE_NONCE_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static boolean stateMatches(String expected, String presented) {
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }

    private static String authorizeUrl(OAuthProvider provider, PendingConnection pending) {
        Map<String, String> variables = Map.of(
                "client_id", provider.clientId(),
                "redirect_uri", pending.redirectUri(),
                "scope", String.join(" ", provider.scopes()),
                "state", pending.stateNonce());
        return UriComponentsBuilder.fromUriString(provider.authorizationEndpoint())
                .queryParam("response_type", "code")
                .queryParam("client_id", "{client_id}")
                .queryParam("redirect_uri", "{redirect_uri}")
                .queryParam("scope", "{scope}")
                .queryParam("state", "{state}")
                .queryParam("access_type", "offline")
                .queryParam("prompt", "consent")
                .encode()
                .buildAndExpand(variables)
                .toUriString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
