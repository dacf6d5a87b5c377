package com.openrag.authservice.infrastructure.oauth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.openrag.authservice.domain.OAuthProvider;
import com.openrag.authservice.domain.OAuthTokens;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

@DisplayName("RestClientTokenExchanger")
class RestClientTokenExchangerTest {

    private static final OAuthProvider PROVIDER = new OAuthProvider("google_drive", "client-1", "secret-1",
            "https://idp.example/authorize", "https://idp.example/token", "https://idp.example/userinfo",
            List.of("openid", "email"));

    private MockRestServiceServer server;
    private RestClientTokenExchanger exchanger;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        exchanger = new RestClientTokenExchanger(builder.build());
    }

    @Test
    @DisplayName("posts the authorization code with client credentials as a form")
    void postsForm() {
        var expectedForm = new LinkedMultiValueMap<String, String>();
        expectedForm.add("grant_type", "authorization_code");
        expectedForm.add("code", "code-1");
        expectedForm.add("redirect_uri", "http://localhost:3000/cb");
        expectedForm.add("client_id", "client-1");
        expectedForm.add("client_secret", "secret-1");
        server.expect(requestTo("https://idp.example/token"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formData(expectedForm))
                .andRespond(withSuccess(
                        "{\"access_token\":\"at\",\"refresh_token\":\"rt\",\"expires_in\":3599,"
                                + "\"scope\":\"openid  email drive\"}",
                        MediaType.APPLICATION_JSON));

        OAuthTokens tokens = exchanger.exchange(PROVIDER, "code-1", "http://localhost:3000/cb");

        assertThat(tokens.accessToken()).isEqualTo("at");
        assertThat(tokens.refreshToken()).isEqualTo("rt");
        assertThat(tokens.expiresIn()).isEqualTo(3599L);
        assertThat(tokens.scopes()).containsExactly("openid", "email", "drive");
        server.verify();
    }

    @Test
    @DisplayName("falls back to the requested scopes when the provider omits them")
    void requestedScopes() {
        server.expect(requestTo("https://idp.example/token"))
                .andRespond(withSuccess("{\"access_token\":\"at\"}", MediaType.APPLICATION_JSON));

        OAuthTokens tokens = exchanger.exchange(PROVIDER, "code-1", "http://localhost:3000/cb");

        assertThat(tokens.scopes()).containsExactly("openid", "email");
        assertThat(tokens.refreshToken()).isNull();
        assertThat(tokens.expiresIn()).isNull();
    }

    @Test
    @DisplayName("fails when the response has no access token")
    void missingAccessToken() {
        server.expect(requestTo("https://idp.example/token"))
                .andRespond(withSuccess("{\"token_type\":\"Bearer\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> exchanger.exchange(PROVIDER, "code-1", "http://localhost:3000/cb"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("access_token");
    }

    @Test
    @DisplayName("propagates provider errors")
    void providerError() {
        server.expect(requestTo("https://idp.example/token"))
                .andRespond(withBadRequest()
                        .body("{\"error\":\"invalid_grant\"}")
                        .contentType(MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> exchanger.exchange(PROVIDER, "used-code", "http://localhost:3000/cb"))
                .isInstanceOf(HttpClientErrorException.class);
    }
}
