package com.openrag.authservice.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrag.authservice.domain.DiscoveryExposer;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/** OIDC discovery, JWKS and token introspection. All public. */
@RestController
public class DiscoveryController {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryController.class);

    private final DiscoveryExposer discoveryExposer;
    private final ObjectMapper objectMapper;

    public DiscoveryController(DiscoveryExposer discoveryExposer, ObjectMapper objectMapper) {
        this.discoveryExposer = discoveryExposer;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/.well-known/openid-configuration")
    public Map<String, Object> openIdConfiguration() {
        String requestBaseUrl = ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString();
        return discoveryExposer.openIdConfiguration(requestBaseUrl);
    }

    @GetMapping("/auth/jwks")
    public Map<String, Object> jwks() {
        return discoveryExposer.jwks();
    }

    /** Reads the body leniently: a missing or malformed body is an inactive token, not an error. */
    @PostMapping("/auth/introspect")
    public Map<String, Object> introspect(@RequestBody(required = false) String body) {
        return discoveryExposer.introspect(tokenFrom(body));
    }

    private String tokenFrom(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode token = objectMapper.readTree(body).path("token");
            return token.isTextual() ? token.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("Unparseable introspection body: {}", e.getOriginalMessage());
            return null;
        }
    }
}
