package com.openrag.authservice.config;

import com.openrag.authservice.domain.OAuthProviderRegistry;
import com.openrag.security.AuthConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Fails application startup on auth settings that would only break at request time: OAuth
 * providers with a client id but no secret (or the reverse), unknown providers without endpoints,
 * and malformed API key digests.
 *
 * <p>A deployment without Google OAuth credentials is valid; it runs in no-auth mode and this
 * validator only logs it.
 */
@Component
public class StartupValidator implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(StartupValidator.class);

    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-fA-F]{64}");

    private final AuthProperties properties;

    public StartupValidator(AuthProperties properties) {
        this.properties = properties;
    }

    @Override
    public void afterPropertiesSet() {
        List<String> problems = validate(properties);
        if (!problems.isEmpty()) {
            throw new AuthConfigurationException("Invalid auth configuration: " + String.join("; ", problems));
        }
        if (properties.noAuthMode()) {
            log.warn("Google OAuth client not configured; running in no-auth mode, every request is anonymous");
        } else {
            log.info("Authentication enabled; issuer {}", properties.issuer());
        }
    }

    static List<String> validate(AuthProperties properties) {
        List<String> problems = new ArrayList<>();
        properties.oauth().providers().forEach((type, provider) -> {
            if (provider.isHalfConfigured()) {
                problems.add("OAuth provider " + type + " needs both client-id and client-secret");
            }
            if (OAuthProviderRegistry.builtIn(type).isEmpty()
                    && (isBlank(provider.authorizationEndpoint()) || isBlank(provider.tokenEndpoint()))) {
                problems.add("OAuth provider " + type + " needs authorization-endpoint and token-endpoint");
            }
        });
        properties.apiKeys().forEach(key -> {
            if (key.keyHash() == null || !SHA256_HEX.matcher(key.keyHash()).matches()) {
                problems.add("API key " + key.keyId() + " must be configured as a SHA-256 hex digest");
            }
        });
        return problems;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
