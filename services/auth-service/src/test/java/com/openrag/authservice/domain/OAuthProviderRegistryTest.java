package com.openrag.authservice.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OAuthProviderRegistry")
class OAuthProviderRegistryTest {

    @Test
    @DisplayName("knows the built-in connector types without credentials")
    void builtIns() {
        OAuthProviderRegistry registry = OAuthProviderRegistry.withDefaults(Map.of());

        assertThat(registry.connectorTypes()).containsExactlyInAnyOrder("google_drive", "onedrive", "sharepoint");
        assertThat(registry.find("google_drive")).hasValueSatisfying(p -> assertThat(p.hasCredentials()).isFalse());
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    @DisplayName("applies configured credentials over built-in endpoints")
    void overrides() {
        OAuthProvider configured = new OAuthProvider("onedrive", "id", "secret",
                "", "", null, List.of());

        OAuthProvider merged = OAuthProviderRegistry.withDefaults(Map.of("onedrive", configured))
                .find("onedrive").orElseThrow();

        assertThat(merged.hasCredentials()).isTrue();
        assertThat(merged.tokenEndpoint()).isEqualTo("https://login.microsoftonline.com/common/oauth2/v2.0/token");
        assertThat(merged.scopes()).contains("offline_access", "Files.Read.All");
    }

    @Test
    @DisplayName("registers custom connector types with their own endpoints")
    void customType() {
        OAuthProvider custom = new OAuthProvider("box", "id", "secret",
                "https://box.example/authorize", "https://box.example/token", null, List.of("read"));

        OAuthProviderRegistry registry = OAuthProviderRegistry.withDefaults(Map.of("box", custom));

        assertThat(registry.find("box")).contains(custom);
        assertThat(OAuthProviderRegistry.builtIn("box")).isEmpty();
    }

    @Test
    @DisplayName("never prints the client secret")
    void toStringHidesSecret() {
        OAuthProvider provider = new OAuthProvider("box", "id", "very-secret",
                "https://box.example/authorize", "https://box.example/token", null, null);

        assertThat(provider.toString()).doesNotContain("very-secret");
    }
}
