package com.openrag.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a machine client from its API key headers.
 * <p>
 * On success the caller gets the key's user plus a short-lived session token restricted to the
 * key's roles and groups, which downstream services (OpenSearch, tools) enforce. Validator
 * failures of any kind are rejections.
 */
public final class ApiKeyAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthenticator.class);

    /** Lifetime of the token minted for an API key request. */
    public static final Duration EPHEMERAL_TOKEN_LIFETIME = Duration.ofDays(1);

    /**
     * A successfully authenticated API key request.
     *
     * @param principal      what the validator returned
     * @param user           user view of the principal
     * @param ephemeralToken restricted session token for downstream calls
     */
    public record Authentication(ApiKeyPrincipal principal, User user, String ephemeralToken) {
    }

    private final ApiKeyValidator validator;
    private final SessionManager sessionManager;

    public ApiKeyAuthenticator(ApiKeyValidator validator, SessionManager sessionManager) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
    }

    /**
     * @throws InvalidApiKeyException with {@code MISSING} when no prefixed key is present, or
     *                                {@code INVALID} when the validator rejects it or fails
     */
    public Authentication authenticate(String apiKeyHeader, String authorizationHeader) {
        String apiKey = ApiKeyExtractor.extract(apiKeyHeader, authorizationHeader)
                .orElseThrow(() -> new InvalidApiKeyException(InvalidApiKeyException.Reason.MISSING));

        ApiKeyPrincipal principal = lookup(apiKey)
                .orElseThrow(() -> new InvalidApiKeyException(InvalidApiKeyException.Reason.INVALID));

        User user = principal.toUser();
        String token = sessionManager.issueToken(user, EPHEMERAL_TOKEN_LIFETIME);
        log.debug("Authenticated API key {} for user {} with roles {} and groups {}",
                principal.keyId(), principal.userId(), principal.roles(), principal.groups());
        return new Authentication(principal, user, token);
    }

    private Optional<ApiKeyPrincipal> lookup(String apiKey) {
        try {
            Optional<ApiKeyPrincipal> result = validator.validate(apiKey);
            return result != null ? result : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("API key validation failed, rejecting key: {}", e.toString());
            return Optional.empty();
        }
    }
}
