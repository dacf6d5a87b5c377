package com.openrag.authservice.infrastructure.oauth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.openrag.authservice.domain.OAuthProvider;
import com.openrag.authservice.domain.OAuthTokens;
import com.openrag.security.User;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@DisplayName("UserInfoIdentityResolver")
class UserInfoIdentityResolverTest {

    private static final OAuthProvider PROVIDER = new OAuthProvider("google_drive", "client-1", "secret-1",
            "https://idp.example/authorize", "https://idp.example/token", "https://idp.example/userinfo",
            List.of("openid"));
    private static final OAuthTokens TOKENS = new OAuthTokens("access-xyz", null, List.of("openid"), 3600L);

    private MockRestServiceServer server;
    private UserInfoIdentityResolver resolver;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        resolver = new UserInfoIdentityResolver(builder.build());
    }

    @Test
    @DisplayName("maps the userinfo claims onto a Google user")
    void resolvesUser() {
        server.expect(requestTo("https://idp.example/userinfo"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer access-xyz"))
                .andRespond(withSuccess(
                        "{\"sub\":\"1089\",\"email\":\"ada@example.com\",\"name\":\"Ada\","
                                + "\"picture\":\"https://img.example/ada.png\"}",
                        MediaType.APPLICATION_JSON));

        User user = resolver.resolve(PROVIDER, TOKENS);

        assertThat(user.userId()).isEqualTo("1089");
        assertThat(user.email()).isEqualTo("ada@example.com");
        assertThat(user.picture()).isEqualTo("https://img.example/ada.png");
        assertThat(user.provider()).isEqualTo("google");
        server.verify();
    }

    @Test
    @DisplayName("fails when the response carries no subject")
    void missingSubject() {
        server.expect(requestTo("https://idp.example/userinfo"))
                .andRespond(withSuccess("{\"email\":\"ada@example.com\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> resolver.resolve(PROVIDER, TOKENS))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("fails for providers without a userinfo endpoint")
    void noUserinfoEndpoint() {
        var provider = new OAuthProvider("box", "id", "secret",
                "https://box.example/authorize", "https://box.example/token", null, List.of());

        assertThatThrownBy(() -> resolver.resolve(provider, TOKENS))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("box");
    }
}
