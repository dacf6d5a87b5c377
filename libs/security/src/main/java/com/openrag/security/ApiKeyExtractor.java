package com.openrag.security;

import java.util.Optional;

/**
 * Extracts machine API keys from request headers.
 * <p>
 * Accepted forms: {@code X-API-Key: orag_<key>} or {@code Authorization: Bearer orag_<key>}.
 * A value is only a candidate key when it carries the {@value #KEY_PREFIX} prefix, so browser
 * session JWTs sent as bearer tokens are never mistaken for API keys.
 */
public final class ApiKeyExtractor {

    /** Prefix every OpenRAG API key carries. */
    public static final String KEY_PREFIX = "orag_";

    /** Dedicated API key header. */
    public static final String API_KEY_HEADER = "X-API-Key";

    public static final String AUTHORIZATION_HEADER = "Authorization";

    private static final String BEARER = "bearer";

    private ApiKeyExtractor() {
        // utility class
    }

    /**
     * Picks the candidate key, preferring the dedicated header.
     *
     * @param apiKeyHeader        value of {@code X-API-Key} (may be null)
     * @param authorizationHeader value of {@code Authorization} (may be null)
     * @return the key, or empty when neither header carries a prefixed key
     */
    public static Optional<String> extract(String apiKeyHeader, String authorizationHeader) {
        if (apiKeyHeader != null && hasRecognizedPrefix(apiKeyHeader.strip())) {
            return Optional.of(apiKeyHeader.strip());
        }
        return extractBearer(authorizationHeader).filter(ApiKeyExtractor::hasRecognizedPrefix);
    }

    /**
     * Extracts the token from a {@code Bearer <token>} header, matching the scheme
     * case-insensitively.
     *
     * @return the token, or empty if the header is missing or uses another scheme
     */
    public static Optional<String> extractBearer(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= BEARER.length()
                || !trimmed.regionMatches(true, 0, BEARER, 0, BEARER.length())
                || !Character.isWhitespace(trimmed.charAt(BEARER.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(BEARER.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    public static boolean hasRecognizedPrefix(String candidate) {
        return candidate != null && candidate.startsWith(KEY_PREFIX) && candidate.length() > KEY_PREFIX.length();
    }
}
