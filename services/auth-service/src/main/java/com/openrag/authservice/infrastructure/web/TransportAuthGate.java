package com.openrag.authservice.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrag.observability.CorrelationContextHolder;
import com.openrag.security.ApiKeyAuthenticator;
import com.openrag.security.ApiKeyExtractor;
import com.openrag.security.InvalidApiKeyException;
import com.openrag.security.SecurityContext;
import com.openrag.security.SecurityContextSnapshot;
import com.openrag.security.SessionManager;
import com.openrag.security.User;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * API key gate in front of the machine transport paths (the MCP endpoint).
 *
 * <p>Every request dispatch must carry an {@code orag_} key in {@code X-API-Key} or {@code
 * Authorization: Bearer}; rejections are answered here with a 401 problem body and never reach the
 * chain. Async and error re-dispatches of an already admitted exchange are lifecycle traffic and
 * pass untouched ({@link OncePerRequestFilter} skips them). In no-auth mode the gate admits every
 * request as the anonymous user.
 *
 * <p>Registered through a {@code FilterRegistrationBean} limited to the configured paths, not as a
 * component.
 */
public class TransportAuthGate extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TransportAuthGate.class);

    private final ApiKeyAuthenticator apiKeyAuthenticator;
    private final SessionManager sessionManager;
    private final ObjectMapper objectMapper;
    private final boolean noAuthMode;

    public TransportAuthGate(
            ApiKeyAuthenticator apiKeyAuthenticator,
            SessionManager sessionManager,
            ObjectMapper objectMapper,
            boolean noAuthMode) {
        this.apiKeyAuthenticator = Objects.requireNonNull(apiKeyAuthenticator, "apiKeyAuthenticator");
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.noAuthMode = noAuthMode;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (noAuthMode) {
            User anonymous = User.anonymous();
            String token = sessionManager.effectiveJwtToken(anonymous.userId(), null, true);
            admit(request, response, filterChain, anonymous, token, "none");
            return;
        }

        ApiKeyAuthenticator.Authentication auth;
        try {
            auth = apiKeyAuthenticator.authenticate(
                    request.getHeader(ApiKeyExtractor.API_KEY_HEADER),
                    request.getHeader(ApiKeyExtractor.AUTHORIZATION_HEADER));
        } catch (InvalidApiKeyException e) {
            log.info("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
            reject(response, e.reason());
            return;
        }
        admit(request, response, filterChain, auth.user(), auth.ephemeralToken(), "api_key");
    }

    private void admit(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain,
            User user,
            String token,
            String authMethod)
            throws ServletException, IOException {
        request.setAttribute(RequestAuthGuard.USER_ATTRIBUTE, user);
        request.setAttribute(RequestAuthGuard.JWT_TOKEN_ATTRIBUTE, token);
        CorrelationContextHolder.attachUser(user.userId(), authMethod);

        SecurityContextSnapshot snapshot = SecurityContextSnapshot.EMPTY.withIdentity(
                user.userId(), token, List.copyOf(user.groups()), List.copyOf(user.roles()));
        try (SecurityContext.Scope ignored = SecurityContext.open(snapshot)) {
            filterChain.doFilter(request, response);
        }
    }

    private void reject(HttpServletResponse response, InvalidApiKeyException.Reason reason) throws IOException {
        ProblemDetail problem = ProblemDetails.of(
                HttpStatus.UNAUTHORIZED, "invalid-api-key", reason.error(), reason.detail());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
