package com.openrag.authservice.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.openrag.security.SessionManager;
import com.openrag.security.testing.TestSessionFactory;
import java.math.BigInteger;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DiscoveryExposer")
class DiscoveryExposerTest {

    private final SessionManager rsaSessions = TestSessionFactory.sessionManager();

    @Nested
    @DisplayName("openid-configuration")
    class OpenIdConfiguration {

        @Test
        @DisplayName("derives every endpoint from the request base URL")
        void requestBaseUrl() {
            Map<String, Object> document = new DiscoveryExposer(rsaSessions, null)
                    .openIdConfiguration("http://localhost:8000/");

            assertThat(document)
                    .containsEntry("issuer", "http://localhost:8000")
                    .containsEntry("authorization_endpoint", "http://localhost:8000/auth/init")
                    .containsEntry("token_endpoint", "http://localhost:8000/auth/callback")
                    .containsEntry("jwks_uri", "http://localhost:8000/auth/jwks")
                    .containsEntry("userinfo_endpoint", "http://localhost:8000/auth/me")
                    .containsEntry("response_types_supported", List.of("code"))
                    .containsEntry("id_token_signing_alg_values_supported", List.of("RS256"));
            assertThat(document)
                    .extractingByKey("claims_supported", InstanceOfAssertFactories.list(String.class))
                    .contains("sub", "email", "preferred_username");
        }

        @Test
        @DisplayName("prefers the configured public base URL")
        void publicBaseUrl() {
            SessionManager sessions = new SessionManager(TestSessionFactory.rsaKeyMaterial(),
                    new SessionManager.Settings("https://rag.example.com", null, null));

            Map<String, Object> document = new DiscoveryExposer(sessions, "https://rag.example.com/")
                    .openIdConfiguration("http://10.0.0.5:8000");

            assertThat(document)
                    .containsEntry("issuer", "https://rag.example.com")
                    .containsEntry("jwks_uri", "https://rag.example.com/auth/jwks");
        }

        @Test
        @DisplayName("advertises the issuer that session tokens carry once a public base URL is set")
        void issuerMatchesTokens() {
            Map<String, Object> document = new DiscoveryExposer(rsaSessions, "https://rag.example.com")
                    .openIdConfiguration("http://10.0.0.5:8000");
            String token = rsaSessions.issueToken(TestSessionFactory.user("user-9"));

            assertThat(document).containsEntry("issuer", rsaSessions.verifyToken(token).orElseThrow().iss());
        }

        @Test
        @DisplayName("advertises HS256 when signing with a shared secret")
        void hmacAlgorithm() {
            SessionManager hmac = TestSessionFactory.sessionManager(TestSessionFactory.hmacKeyMaterial(), Clock.systemUTC());

            assertThat(new DiscoveryExposer(hmac, null).openIdConfiguration("http://localhost:8000"))
                    .containsEntry("id_token_signing_alg_values_supported", List.of("HS256"));
        }
    }

    @Nested
    @DisplayName("jwks")
    class Jwks {

        @Test
        @DisplayName("publishes the signing key whose modulus and exponent match the public key")
        void publishesRsaKey() {
            Map<String, Object> jwks = new DiscoveryExposer(rsaSessions, null).jwks();

            List<?> keys = (List<?>) jwks.get("keys");
            assertThat(keys).hasSize(1);
            Map<?, ?> key = (Map<?, ?>) keys.get(0);
            RSAPublicKey publicKey = rsaSessions.rsaPublicKey().orElseThrow();
            assertThat(key.get("kty")).isEqualTo("RSA");
            assertThat(key.get("use")).isEqualTo("sig");
            assertThat(key.get("alg")).isEqualTo("RS256");
            assertThat(key.get("kid")).isEqualTo(rsaSessions.keyId());
            assertThat(base64UrlInteger((String) key.get("n"))).isEqualTo(publicKey.getModulus());
            assertThat(base64UrlInteger((String) key.get("e"))).isEqualTo(publicKey.getPublicExponent());
            assertThat(key.containsKey("d")).isFalse();
        }

        @Test
        @DisplayName("is empty when signing with a shared secret")
        void emptyForHmac() {
            SessionManager hmac = TestSessionFactory.sessionManager(TestSessionFactory.hmacKeyMaterial(), Clock.systemUTC());

            assertThat((List<?>) new DiscoveryExposer(hmac, null).jwks().get("keys")).isEmpty();
        }

        private static BigInteger base64UrlInteger(String value) {
            return new BigInteger(1, Base64.getUrlDecoder().decode(value));
        }
    }

    @Nested
    @DisplayName("introspect")
    class Introspect {

        @Test
        @DisplayName("describes a valid session token")
        void activeToken() {
            String token = rsaSessions.issueToken(TestSessionFactory.user("user-3"));

            Map<String, Object> response = new DiscoveryExposer(rsaSessions, null).introspect(token);

            assertThat(response)
                    .containsEntry("active", true)
                    .containsEntry("sub", "user-3")
                    .containsEntry("email", "user-3@openrag.local")
                    .containsEntry("iss", SessionManager.DEFAULT_ISSUER)
                    .containsEntry("aud", SessionManager.DEFAULT_AUDIENCES);
            assertThat((Long) response.get("exp")).isGreaterThan((Long) response.get("iat"));
        }

        @Test
        @DisplayName("reports anything else as inactive")
        void inactive() {
            var exposer = new DiscoveryExposer(rsaSessions, null);
            String foreign = TestSessionFactory.sessionManager(TestSessionFactory.otherRsaKeyMaterial(), Clock.systemUTC())
                    .issueToken(TestSessionFactory.user("user-3"));

            assertThat(exposer.introspect("not.a.token")).isEqualTo(Map.of("active", false));
            assertThat(exposer.introspect(null)).isEqualTo(Map.of("active", false));
            assertThat(exposer.introspect(foreign)).isEqualTo(Map.of("active", false));
        }
    }
}
