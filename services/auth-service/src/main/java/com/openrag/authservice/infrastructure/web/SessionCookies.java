package com.openrag.authservice.infrastructure.web;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Duration;
import java.util.Optional;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

/**
 * Reads and writes the browser session cookie: HttpOnly, SameSite=Lax, path {@code /}, max-age
 * equal to the session lifetime.
 */
public class SessionCookies {

    private final String name;
    private final boolean secure;
    private final Duration maxAge;

    public SessionCookies(String name, boolean secure, Duration maxAge) {
        this.name = name;
        this.secure = secure;
        this.maxAge = maxAge;
    }

    public String name() {
        return name;
    }

    public Optional<String> read(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, name);
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    public ResponseCookie issue(String token) {
        return base(token).maxAge(maxAge).build();
    }

    public ResponseCookie clear() {
        return base("").maxAge(Duration.ZERO).build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Lax")
                .path("/");
    }
}
