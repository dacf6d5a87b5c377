package com.openrag.authservice.infrastructure.web;

import com.openrag.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Builds the RFC 7807 error bodies shared by {@link GlobalExceptionHandler} and {@link
 * TransportAuthGate}.
 *
 * <pre>
 * {
 *   "type": "https://openrag.dev/errors/authentication-required",
 *   "title": "Authentication required",
 *   "status": 401,
 *   "detail": "Sign in to continue",
 *   "error": "Authentication required",
 *   "message": "Sign in to continue",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>{@code error} and {@code message} are the stable fields clients match on.
 */
public final class ProblemDetails {

    static final String TYPE_BASE = "https://openrag.dev/errors/";

    private ProblemDetails() {
        // utility class
    }

    public static ProblemDetail of(HttpStatus status, String type, String error, String message) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, message);
        problem.setTitle(error);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setProperty("error", error);
        problem.setProperty("message", message);
        return enrich(problem);
    }

    /** Adds timestamp and correlation id. */
    public static ProblemDetail enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
