package com.openrag.authservice.api;

import com.openrag.authservice.config.AuthProperties;
import com.openrag.authservice.domain.OAuthCallbackResult;
import com.openrag.authservice.domain.OAuthConnectionFlow;
import com.openrag.authservice.domain.OAuthInitResult;
import com.openrag.authservice.infrastructure.web.AuthOptional;
import com.openrag.authservice.infrastructure.web.RequestAuthGuard;
import com.openrag.authservice.infrastructure.web.SessionCookies;
import com.openrag.security.User;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Browser login and OAuth connection routes under {@code /auth}.
 *
 * <p>The app-login session token only ever travels in the {@code Set-Cookie} header; no response
 * body carries it.
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final OAuthConnectionFlow connectionFlow;
    private final SessionCookies sessionCookies;
    private final boolean noAuthMode;

    public AuthController(
            OAuthConnectionFlow connectionFlow, SessionCookies sessionCookies, AuthProperties properties) {
        this.connectionFlow = connectionFlow;
        this.sessionCookies = sessionCookies;
        this.noAuthMode = properties.noAuthMode();
    }

    @PostMapping("/init")
    @AuthOptional
    public Map<String, Object> init(@RequestBody OAuthInitRequest body, HttpServletRequest request) {
        User user = RequestAuthGuard.currentUser(request);
        OAuthInitResult result = connectionFlow.init(
                body.connectorType(),
                body.purpose(),
                body.name(),
                body.redirectUri(),
                user != null ? user.userId() : null);

        Map<String, Object> oauthConfig = new LinkedHashMap<>();
        oauthConfig.put("client_id", result.clientConfig().clientId());
        oauthConfig.put("scopes", result.clientConfig().scopes());
        oauthConfig.put("redirect_uri", result.clientConfig().redirectUri());
        oauthConfig.put("authorization_endpoint", result.clientConfig().authorizationEndpoint());
        oauthConfig.put("token_endpoint", result.clientConfig().tokenEndpoint());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("connection_id", result.connectionId());
        response.put("authorize_url", result.authorizeUrl());
        response.put("oauth_config", oauthConfig);
        return response;
    }

    @PostMapping("/callback")
    public ResponseEntity<Map<String, Object>> callback(@RequestBody OAuthCallbackRequest body) {
        OAuthCallbackResult result =
                connectionFlow.callback(body.connectionId(), body.authorizationCode(), body.state());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", OAuthCallbackResult.STATUS_AUTHENTICATED);
        response.put("connection_id", result.connectionId());
        response.put("purpose", result.purpose().wireName());
        response.put("connector_type", result.connectorType());
        if (!result.isAppLogin()) {
            return ResponseEntity.ok(response);
        }
        response.put("user_id", result.userId());
        response.put("google_drive_connection_id", result.dataSourceConnectionId());
        response.put("redirect", "/");
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookies.issue(result.sessionToken()).toString())
                .body(response);
    }

    @GetMapping("/me")
    @AuthOptional
    public Map<String, Object> me(HttpServletRequest request) {
        Map<String, Object> response = new LinkedHashMap<>();
        if (noAuthMode) {
            response.put("authenticated", false);
            response.put("user", null);
            response.put("no_auth_mode", true);
            return response;
        }
        User user = RequestAuthGuard.currentUser(request);
        if (user == null) {
            response.put("authenticated", false);
            response.put("user", null);
            return response;
        }
        Map<String, Object> userView = new LinkedHashMap<>();
        userView.put("user_id", user.userId());
        userView.put("email", user.email());
        userView.put("name", user.name());
        userView.put("picture", user.picture());
        userView.put("provider", user.provider());
        response.put("authenticated", true);
        response.put("user", userView);
        return response;
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout() {
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookies.clear().toString())
                .body(Map.of("status", "logged_out", "message", "Successfully logged out"));
    }
}
