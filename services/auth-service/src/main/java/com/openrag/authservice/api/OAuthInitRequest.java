package com.openrag.authservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /auth/init}.
 *
 * @param connectorType connector type, e.g. {@code google_drive}
 * @param purpose {@code app_auth} or {@code data_source} (default)
 * @param name connection display name
 * @param redirectUri where the provider redirects back to
 */
public record OAuthInitRequest(
        @JsonProperty("connector_type") String connectorType,
        @JsonProperty("purpose") String purpose,
        @JsonProperty("name") String name,
        @JsonProperty("redirect_uri") String redirectUri) {

    public OAuthInitRequest {
        if (purpose == null || purpose.isBlank()) {
            purpose = "data_source";
        }
    }
}
