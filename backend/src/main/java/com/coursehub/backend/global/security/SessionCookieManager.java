package com.coursehub.backend.global.security;

import java.time.Duration;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import com.coursehub.backend.modules.session.domain.IssuedSession;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

/**
 * Moves the opaque session handle between the client and the server. The cookie is HttpOnly,
 * SameSite-restricted and, when configured, Secure; it never carries session fields.
 */
@Component
public class SessionCookieManager {

    private final String cookieName;
    private final boolean secure;
    private final String sameSite;
    private final String path;
    private final Duration rememberFor;

    public SessionCookieManager(
            @Value("${app.session.cookie.name:COURSEHUB_SESSION}") String cookieName,
            @Value("${app.session.cookie.secure:false}") boolean secure,
            @Value("${app.session.cookie.same-site:Lax}") String sameSite,
            @Value("${app.session.cookie.path:/}") String path,
            @Value("${app.session.idle-timeout:PT24H}") Duration rememberFor
    ) {
        this.cookieName = cookieName;
        this.secure = secure;
        this.sameSite = sameSite;
        this.path = path;
        this.rememberFor = rememberFor;
    }

    public String extract(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, cookieName);
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return null;
        }
        return cookie.getValue();
    }

    /**
     * A remembered session survives browser restarts for the idle timeout; otherwise the cookie
     * lives as long as the browser session.
     */
    public void write(HttpServletResponse response, IssuedSession session) {
        ResponseCookie.ResponseCookieBuilder builder = baseCookie(session.handle());
        if (session.session().permanent()) {
            builder.maxAge(rememberFor);
        }
        response.addHeader(HttpHeaders.SET_COOKIE, builder.build().toString());
    }

    public void clear(HttpServletResponse response) {
        ResponseCookie cookie = baseCookie("").maxAge(Duration.ZERO).build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    public String getCookieName() {
        return cookieName;
    }

    private ResponseCookie.ResponseCookieBuilder baseCookie(String value) {
        return ResponseCookie.from(cookieName, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite(sameSite)
                .path(path);
    }
}
