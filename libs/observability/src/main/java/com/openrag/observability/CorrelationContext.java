package com.openrag.observability;

/**
 * Immutable correlation context for one inbound request.
 * <p>
 * Established at the HTTP boundary and mirrored into SLF4J MDC so every log line written while
 * the request is handled carries the same identifiers.
 *
 * @param correlationId unique ID for the request chain (propagated via {@code X-Correlation-ID})
 * @param userId        resolved caller, once authentication has run (nullable before that)
 * @param authMethod    how the caller was authenticated: {@code session}, {@code api_key},
 *                      {@code no_auth} (nullable before authentication)
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String authMethod
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for the authentication method. */
    public static final String MDC_AUTH_METHOD = "authMethod";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context carrying only a correlation ID, as created before authentication runs. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }

    /** Returns a copy that records the authenticated caller. */
    public CorrelationContext withUser(String userId, String authMethod) {
        return new CorrelationContext(correlationId, userId, authMethod);
    }
}
