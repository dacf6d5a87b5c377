package com.openrag.authservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrag.authservice.domain.ConnectionCredentialStore;
import com.openrag.authservice.domain.DiscoveryExposer;
import com.openrag.authservice.domain.OAuthConnectionFlow;
import com.openrag.authservice.domain.OAuthProvider;
import com.openrag.authservice.domain.OAuthProviderRegistry;
import com.openrag.authservice.domain.OAuthTokenExchanger;
import com.openrag.authservice.domain.PendingConnectionStore;
import com.openrag.authservice.domain.ProviderIdentityResolver;
import com.openrag.authservice.infrastructure.apikey.ConfiguredApiKeyValidator;
import com.openrag.authservice.infrastructure.oauth.InMemoryConnectionCredentialStore;
import com.openrag.authservice.infrastructure.oauth.RestClientTokenExchanger;
import com.openrag.authservice.infrastructure.oauth.UserInfoIdentityResolver;
import com.openrag.authservice.infrastructure.web.RequestAuthGuard;
import com.openrag.authservice.infrastructure.web.SessionCookies;
import com.openrag.authservice.infrastructure.web.TransportAuthGate;
import com.openrag.security.ApiKeyAuthenticator;
import com.openrag.security.ApiKeyPrincipal;
import com.openrag.security.ApiKeyValidator;
import com.openrag.security.KeyMaterial;
import com.openrag.security.KeyMaterialLoader;
import com.openrag.security.SessionManager;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.core.Ordered;
import org.springframework.web.client.RestClient;

/**
 * Wires the auth core from {@link AuthProperties}.
 *
 * <p>Collaborators that reach outside the process ({@link ApiKeyValidator}, {@link
 * OAuthTokenExchanger}, {@link ProviderIdentityResolver}, {@link ConnectionCredentialStore}) are
 * {@link ConditionalOnMissingBean} so a deployment can supply its own.
 */
@Configuration
@DependsOn("startupValidator")
public class SecurityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyMaterial keyMaterial(AuthProperties properties) {
        AuthProperties.Jwt jwt = properties.jwt();
        return KeyMaterialLoader.load(new KeyMaterialLoader.Settings(
                jwt.signingKey(), jwt.privateKeyPath(), jwt.publicKeyPath(), jwt.generateIfMissing()));
    }

    @Bean
    public SessionManager sessionManager(KeyMaterial keyMaterial, AuthProperties properties, Clock clock) {
        return new SessionManager(
                keyMaterial,
                new SessionManager.Settings(
                        properties.issuer(), properties.audiences(), properties.sessionLifetime()),
                clock);
    }

    @Bean
    public SessionCookies sessionCookies(AuthProperties properties) {
        return new SessionCookies(
                properties.cookie().name(), properties.cookie().secure(), properties.sessionLifetime());
    }

    @Bean
    @ConditionalOnMissingBean
    public ApiKeyValidator apiKeyValidator(AuthProperties properties) {
        return new ConfiguredApiKeyValidator(properties.apiKeys().stream()
                .map(key -> new ConfiguredApiKeyValidator.KeyRecord(
                        key.keyHash(),
                        new ApiKeyPrincipal(
                                key.keyId(), key.userId(), key.userEmail(), key.name(), key.roles(), key.groups())))
                .toList());
    }

    @Bean
    public ApiKeyAuthenticator apiKeyAuthenticator(ApiKeyValidator apiKeyValidator, SessionManager sessionManager) {
        return new ApiKeyAuthenticator(apiKeyValidator, sessionManager);
    }

    @Bean
    public RequestAuthGuard requestAuthGuard(
            SessionManager sessionManager,
            ApiKeyAuthenticator apiKeyAuthenticator,
            SessionCookies sessionCookies,
            AuthProperties properties) {
        return new RequestAuthGuard(sessionManager, apiKeyAuthenticator, sessionCookies, properties.noAuthMode());
    }

    @Bean
    public FilterRegistrationBean<TransportAuthGate> transportAuthGate(
            ApiKeyAuthenticator apiKeyAuthenticator,
            SessionManager sessionManager,
            ObjectMapper objectMapper,
            AuthProperties properties) {
        var registration = new FilterRegistrationBean<>(new TransportAuthGate(
                apiKeyAuthenticator, sessionManager, objectMapper, properties.noAuthMode()));
        registration.setUrlPatterns(properties.transportPaths());
        // After CorrelationIdFilter.
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }

    @Bean
    public OAuthProviderRegistry oauthProviderRegistry(AuthProperties properties) {
        Map<String, OAuthProvider> configured = new LinkedHashMap<>();
        properties.oauth().providers().forEach((type, provider) -> configured.put(type,
                OAuthProviderRegistry.builtIn(type)
                        .map(base -> base.withOverrides(
                                provider.clientId(),
                                provider.clientSecret(),
                                provider.authorizationEndpoint(),
                                provider.tokenEndpoint(),
                                provider.userinfoEndpoint(),
                                provider.scopes()))
                        .orElseGet(() -> new OAuthProvider(
                                type,
                                provider.clientId(),
                                provider.clientSecret(),
                                provider.authorizationEndpoint(),
                                provider.tokenEndpoint(),
                                provider.userinfoEndpoint(),
                                provider.scopes()))));
        return OAuthProviderRegistry.withDefaults(configured);
    }

    @Bean
    public PendingConnectionStore pendingConnectionStore() {
        return new PendingConnectionStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public OAuthTokenExchanger oauthTokenExchanger(RestClient.Builder restClientBuilder) {
        return new RestClientTokenExchanger(restClientBuilder.build());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProviderIdentityResolver providerIdentityResolver(RestClient.Builder restClientBuilder) {
        return new UserInfoIdentityResolver(restClientBuilder.build());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionCredentialStore connectionCredentialStore() {
        return new InMemoryConnectionCredentialStore();
    }

    @Bean
    public OAuthConnectionFlow oauthConnectionFlow(
            OAuthProviderRegistry registry,
            PendingConnectionStore pendingConnectionStore,
            OAuthTokenExchanger tokenExchanger,
            ProviderIdentityResolver identityResolver,
            ConnectionCredentialStore credentialStore,
            SessionManager sessionManager,
            AuthProperties properties,
            Clock clock) {
        return new OAuthConnectionFlow(
                registry,
                pendingConnectionStore,
                tokenExchanger,
                identityResolver,
                credentialStore,
                sessionManager,
                new OAuthConnectionFlow.Settings(
                        properties.oauth().stateTtl(), properties.oauth().webhookBaseUrl(), properties.noAuthMode()),
                clock);
    }

    @Bean
    public DiscoveryExposer discoveryExposer(SessionManager sessionManager, AuthProperties properties) {
        return new DiscoveryExposer(sessionManager, properties.publicBaseUrl());
    }
}
