package com.openrag.authservice.infrastructure.web;

import com.openrag.authservice.domain.OAuthExchangeFailedException;
import com.openrag.authservice.domain.OAuthStateInvalidException;
import com.openrag.security.AuthConfigurationException;
import com.openrag.security.AuthenticationRequiredException;
import com.openrag.security.InvalidApiKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the auth exception taxonomy to RFC 7807 responses built by {@link ProblemDetails}.
 *
 * <table>
 *   <caption>Status mapping</caption>
 *   <tr><td>{@link AuthenticationRequiredException}</td><td>401</td></tr>
 *   <tr><td>{@link InvalidApiKeyException}</td><td>401</td></tr>
 *   <tr><td>{@link OAuthStateInvalidException}</td><td>400</td></tr>
 *   <tr><td>{@link AuthConfigurationException}</td><td>400</td></tr>
 *   <tr><td>{@link OAuthExchangeFailedException}</td><td>502</td></tr>
 * </table>
 *
 * <p>Messages of unexpected exceptions never reach the client.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AuthenticationRequiredException.class)
    public ProblemDetail handleAuthenticationRequired(AuthenticationRequiredException ex) {
        log.debug("Rejected request without a valid session");
        return ProblemDetails.of(
                HttpStatus.UNAUTHORIZED,
                "authentication-required",
                "Authentication required",
                "A valid session is required for this endpoint");
    }

    @ExceptionHandler(InvalidApiKeyException.class)
    public ProblemDetail handleInvalidApiKey(InvalidApiKeyException ex) {
        log.info("Rejected API key request: {}", ex.getMessage());
        return ProblemDetails.of(
                HttpStatus.UNAUTHORIZED, "invalid-api-key", ex.reason().error(), ex.reason().detail());
    }

    @ExceptionHandler(OAuthStateInvalidException.class)
    public ProblemDetail handleOAuthStateInvalid(OAuthStateInvalidException ex) {
        return ProblemDetails.of(
                HttpStatus.BAD_REQUEST, "oauth-state-invalid", "Invalid OAuth state", ex.getMessage());
    }

    @ExceptionHandler(OAuthExchangeFailedException.class)
    public ProblemDetail handleOAuthExchangeFailed(OAuthExchangeFailedException ex) {
        log.warn("OAuth exchange failed for {}: {}", ex.connectorType(), ex.getMessage());
        return ProblemDetails.of(
                HttpStatus.BAD_GATEWAY,
                "oauth-exchange-failed",
                "OAuth exchange failed",
                ex.getMessage() + " for " + ex.connectorType());
    }

    @ExceptionHandler(AuthConfigurationException.class)
    public ProblemDetail handleAuthConfiguration(AuthConfigurationException ex) {
        log.warn("Auth configuration error: {}", ex.getMessage());
        return ProblemDetails.of(
                HttpStatus.BAD_REQUEST, "auth-not-configured", "Authentication not configured", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, "bad-request", "Bad Request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return ProblemDetails.of(HttpStatus.BAD_REQUEST, "validation", "Validation Error", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ProblemDetails.of(
                HttpStatus.BAD_REQUEST, "bad-request", "Bad Request", "Request body is missing or malformed");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Framework errors (404, 405, 415) keep their own status.
            return ProblemDetails.enrich(errorResponse.getBody());
        }
        log.error("Internal server error", ex);
        return ProblemDetails.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "internal",
                "Internal Server Error",
                "An unexpected error occurred");
    }
}
