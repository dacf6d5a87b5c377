package com.openrag.authservice.infrastructure.web;

import com.openrag.observability.CorrelationContextHolder;
import com.openrag.security.ApiKeyAuthenticator;
import com.openrag.security.ApiKeyExtractor;
import com.openrag.security.AuthenticationRequiredException;
import com.openrag.security.SecurityContext;
import com.openrag.security.SecurityContextSnapshot;
import com.openrag.security.SessionManager;
import com.openrag.security.User;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.lang.annotation.Annotation;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.AsyncHandlerInterceptor;

/**
 * Resolves the caller of annotated handlers before they run.
 *
 * <ul>
 *   <li>{@link AuthRequired}: session cookie must verify, otherwise {@link
 *       AuthenticationRequiredException}
 *   <li>{@link AuthOptional}: session cookie resolves the user when valid, otherwise no user
 *   <li>{@link ApiKeyRequired}: {@code orag_} key must validate; the handler gets a one-day token
 *       restricted to the key's roles and groups
 * </ul>
 *
 * <p>In no-auth mode both session modes resolve to {@link User#anonymous()} without looking at the
 * cookie at all. The resolved user and raw token are exposed as request attributes and seeded into
 * {@link SecurityContext} for the handler; the scope is closed when the request completes.
 */
public class RequestAuthGuard implements AsyncHandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RequestAuthGuard.class);

    public static final String USER_ATTRIBUTE = RequestAuthGuard.class.getName() + ".user";
    public static final String JWT_TOKEN_ATTRIBUTE = RequestAuthGuard.class.getName() + ".jwtToken";
    private static final String SCOPE_ATTRIBUTE = RequestAuthGuard.class.getName() + ".scope";

    private enum Mode { REQUIRED, OPTIONAL, API_KEY }

    private final SessionManager sessionManager;
    private final ApiKeyAuthenticator apiKeyAuthenticator;
    private final SessionCookies cookies;
    private final boolean noAuthMode;

    public RequestAuthGuard(
            SessionManager sessionManager,
            ApiKeyAuthenticator apiKeyAuthenticator,
            SessionCookies cookies,
            boolean noAuthMode) {
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.apiKeyAuthenticator = Objects.requireNonNull(apiKeyAuthenticator, "apiKeyAuthenticator");
        this.cookies = Objects.requireNonNull(cookies, "cookies");
        this.noAuthMode = noAuthMode;
    }

    /** User resolved for {@code request}, or null. */
    public static User currentUser(HttpServletRequest request) {
        return (User) request.getAttribute(USER_ATTRIBUTE);
    }

    /** Raw token resolved for {@code request}, or null. */
    public static String currentToken(HttpServletRequest request) {
        return (String) request.getAttribute(JWT_TOKEN_ATTRIBUTE);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        Mode mode = modeOf(handlerMethod);
        if (mode == null) {
            return true;
        }

        User user;
        String token;
        String authMethod;
        if (mode == Mode.API_KEY) {
            ApiKeyAuthenticator.Authentication auth = apiKeyAuthenticator.authenticate(
                    request.getHeader(ApiKeyExtractor.API_KEY_HEADER),
                    request.getHeader(ApiKeyExtractor.AUTHORIZATION_HEADER));
            user = auth.user();
            token = auth.ephemeralToken();
            authMethod = "api_key";
        } else if (noAuthMode) {
            user = User.anonymous();
            token = null;
            authMethod = "none";
        } else {
            token = cookies.read(request).orElse(null);
            user = token != null ? sessionManager.getUserFromToken(token).orElse(null) : null;
            if (user == null) {
                token = null;
                if (mode == Mode.REQUIRED) {
                    throw new AuthenticationRequiredException();
                }
            }
            authMethod = "session";
        }

        request.setAttribute(USER_ATTRIBUTE, user);
        request.setAttribute(JWT_TOKEN_ATTRIBUTE, token);
        if (user != null) {
            CorrelationContextHolder.attachUser(user.userId(), authMethod);
        }
        seedSecurityContext(request, user, token);
        return true;
    }

    @Override
    public void afterConcurrentHandlingStarted(
            HttpServletRequest request, HttpServletResponse response, Object handler) {
        closeScope(request);
    }

    @Override
    public void afterCompletion(
            HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        closeScope(request);
    }

    private void seedSecurityContext(HttpServletRequest request, User user, String token) {
        SecurityContextSnapshot snapshot;
        if (user == null) {
            snapshot = SecurityContextSnapshot.EMPTY;
        } else {
            String effectiveToken = sessionManager.effectiveJwtToken(user.userId(), token, noAuthMode);
            snapshot = SecurityContextSnapshot.EMPTY.withIdentity(
                    user.userId(), effectiveToken, List.copyOf(user.groups()), List.copyOf(user.roles()));
        }
        closeScope(request);
        request.setAttribute(SCOPE_ATTRIBUTE, SecurityContext.open(snapshot));
    }

    private static void closeScope(HttpServletRequest request) {
        Object scope = request.getAttribute(SCOPE_ATTRIBUTE);
        if (scope instanceof SecurityContext.Scope openScope) {
            request.removeAttribute(SCOPE_ATTRIBUTE);
            try {
                openScope.close();
            } catch (IllegalStateException e) {
                log.warn("SecurityContext scope not closed on its own thread; clearing", e);
                SecurityContext.clear();
            }
        }
    }

    private static Mode modeOf(HandlerMethod handler) {
        if (has(handler, ApiKeyRequired.class)) {
            return Mode.API_KEY;
        }
        if (has(handler, AuthRequired.class)) {
            return Mode.REQUIRED;
        }
        if (has(handler, AuthOptional.class)) {
            return Mode.OPTIONAL;
        }
        return null;
    }

    private static boolean has(HandlerMethod handler, Class<? extends Annotation> type) {
        return handler.hasMethodAnnotation(type)
                || AnnotatedElementUtils.hasAnnotation(handler.getBeanType(), type);
    }
}
