package com.openrag.authservice.infrastructure.oauth;

import com.openrag.authservice.domain.OAuthProvider;
import com.openrag.authservice.domain.OAuthTokenExchanger;
import com.openrag.authservice.domain.OAuthTokens;
import com.openrag.observability.SensitiveDataRedactor;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

/**
 * Authorization-code exchange against a provider token endpoint (RFC 6749 section 4.1.3), with
 * client credentials sent in the form body as Google and Microsoft expect.
 */
public class RestClientTokenExchanger implements OAuthTokenExchanger {

    private static final Logger log = LoggerFactory.getLogger(RestClientTokenExchanger.class);

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    public RestClientTokenExchanger(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public OAuthTokens exchange(OAuthProvider provider, String authorizationCode, String redirectUri) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", authorizationCode);
        form.add("redirect_uri", redirectUri);
        form.add("client_id", provider.clientId());
        form.add("client_secret", provider.clientSecret());

        Map<String, Object> body = restClient.post()
                .uri(provider.tokenEndpoint())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(form)
                .retrieve()
                .body(JSON_OBJECT);
        if (body == null) {
            throw new IllegalStateException("Empty response from " + provider.tokenEndpoint());
        }
        if (log.isDebugEnabled()) {
            log.debug("Token response from {}: {}", provider.connectorType(), redactor.redact(body));
        }

        Object accessToken = body.get("access_token");
        if (!(accessToken instanceof String token) || token.isBlank()) {
            throw new IllegalStateException("Token response carried no access_token");
        }
        return new OAuthTokens(
                token,
                body.get("refresh_token") instanceof String refresh ? refresh : null,
                scopes(body.get("scope"), provider.scopes()),
                body.get("expires_in") instanceof Number expiresIn ? expiresIn.longValue() : null);
    }

    private static List<String> scopes(Object granted, List<String> requested) {
        if (granted instanceof String scope && !scope.isBlank()) {
            return Arrays.asList(scope.trim().split("\\s+"));
        }
        return requested;
    }
}
