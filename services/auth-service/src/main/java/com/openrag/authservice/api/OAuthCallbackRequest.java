package com.openrag.authservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code POST /auth/callback}. */
public record OAuthCallbackRequest(
        @JsonProperty("connection_id") String connectionId,
        @JsonProperty("authorization_code") String authorizationCode,
        @JsonProperty("state") String state) {
}
