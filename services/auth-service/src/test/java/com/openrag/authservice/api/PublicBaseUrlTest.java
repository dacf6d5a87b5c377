package com.openrag.authservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrag.security.SessionClaims;
import com.openrag.security.SessionManager;
import com.openrag.security.testing.TestSessionFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/** Service deployed behind {@code https://rag.example.com} with no explicit issuer. */
@SpringBootTest(properties = {
    "openrag.auth.public-base-url=https://rag.example.com",
    "openrag.auth.issuer="
})
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Public base URL")
class PublicBaseUrlTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private SessionManager sessionManager;
    @Autowired private ObjectMapper objectMapper;

    @Test
    @DisplayName("discovery issuer is the iss of every session token")
    void discoveryIssuerMatchesTokens() throws Exception {
        String body = mockMvc.perform(get("/.well-known/openid-configuration"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode document = objectMapper.readTree(body);

        SessionClaims claims = sessionManager.verifyToken(
                sessionManager.issueToken(TestSessionFactory.user("user-7"))).orElseThrow();

        assertThat(document.get("issuer").asText())
                .isEqualTo(claims.iss())
                .isEqualTo("https://rag.example.com");
        assertThat(document.get("jwks_uri").asText()).isEqualTo("https://rag.example.com/auth/jwks");
    }

    @Test
    @DisplayName("introspection reports the same issuer")
    void introspectionIssuer() throws Exception {
        String token = sessionManager.issueToken(TestSessionFactory.user("user-7"));

        mockMvc.perform(post("/auth/introspect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + token + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.iss").value("https://rag.example.com"));
    }
}
