package com.openrag.authservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuthProperties")
class AuthPropertiesTest {

    private static AuthProperties withProviders(Map<String, AuthProperties.Provider> providers) {
        return new AuthProperties(null, null, null, null, null, null,
                new AuthProperties.OAuth(null, null, providers), null, null);
    }

    private static AuthProperties.Provider provider(String clientId, String clientSecret) {
        return new AuthProperties.Provider(clientId, clientSecret, null, null, null, null);
    }

    @Test
    @DisplayName("applies defaults when values are null")
    void appliesDefaults() {
        var props = new AuthProperties(null, null, null, null, null, null, null, null, null);

        assertThat(props.issuer()).isEqualTo("http://openrag-backend:8000");
        assertThat(props.audiences()).containsExactly("opensearch", "openrag");
        assertThat(props.sessionLifetime()).isEqualTo(Duration.ofDays(7));
        assertThat(props.jwt().privateKeyPath()).isEqualTo(Path.of("keys", "private_key.pem"));
        assertThat(props.jwt().generateIfMissing()).isTrue();
        assertThat(props.cookie().name()).isEqualTo("auth_token");
        assertThat(props.cookie().secure()).isFalse();
        assertThat(props.oauth().stateTtl()).isEqualTo(Duration.ofMinutes(10));
        assertThat(props.transportPaths()).containsExactly("/mcp/*");
        assertThat(props.apiKeys()).isEmpty();
    }

    @Test
    @DisplayName("issuer follows the public base URL when not set explicitly")
    void issuerFromPublicBaseUrl() {
        var props = new AuthProperties(" ", "https://rag.example.com/", null, null, null, null, null, null, null);

        assertThat(props.issuer()).isEqualTo("https://rag.example.com");
    }

    @Test
    @DisplayName("preserves explicit values")
    void preservesExplicitValues() {
        var props = new AuthProperties("https://rag.example.com", "https://rag.example.com", List.of("openrag"),
                Duration.ofHours(12), null, new AuthProperties.Cookie("sid", true),
                new AuthProperties.OAuth(Duration.ofMinutes(5), " ", null), List.of("/mcp/**"), null);

        assertThat(props.issuer()).isEqualTo("https://rag.example.com");
        assertThat(props.audiences()).containsExactly("openrag");
        assertThat(props.sessionLifetime()).isEqualTo(Duration.ofHours(12));
        assertThat(props.cookie().name()).isEqualTo("sid");
        assertThat(props.cookie().secure()).isTrue();
        assertThat(props.oauth().stateTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(props.oauth().webhookBaseUrl()).isNull();
        assertThat(props.transportPaths()).containsExactly("/mcp/**");
    }

    @Test
    @DisplayName("runs in no-auth mode unless Google has both client id and secret")
    void noAuthMode() {
        assertThat(withProviders(null).noAuthMode()).isTrue();
        assertThat(withProviders(Map.of("google_drive", provider("id", ""))).noAuthMode()).isTrue();
        assertThat(withProviders(Map.of("onedrive", provider("id", "secret"))).noAuthMode()).isTrue();
        assertThat(withProviders(Map.of("google_drive", provider("id", "secret"))).noAuthMode()).isFalse();
    }

    @Test
    @DisplayName("detects half-configured providers")
    void halfConfigured() {
        assertThat(provider("id", null).isHalfConfigured()).isTrue();
        assertThat(provider(null, "secret").isHalfConfigured()).isTrue();
        assertThat(provider(null, null).isHalfConfigured()).isFalse();
        assertThat(provider("id", "secret").isHalfConfigured()).isFalse();
    }
}
