package com.coursehub.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the client identifier used for rate-limit bucketing and security events.
 *
 * <p>Precedence:
 * <ol>
 *   <li>first entry of {@code X-Forwarded-For}</li>
 *   <li>{@code X-Real-IP}</li>
 *   <li>the peer address of the connection</li>
 * </ol>
 */
public final class ClientIpResolver {

    public static final String X_FORWARDED_FOR = "X-Forwarded-For";
    public static final String X_REAL_IP = "X-Real-IP";

    private ClientIpResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        return resolve(request.getHeader(X_FORWARDED_FOR), request.getHeader(X_REAL_IP), request.getRemoteAddr());
    }

    static String resolve(String forwardedFor, String realIp, String remoteAddress) {
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return forwardedFor.split(",")[0].trim();
        }
        if (realIp != null && !realIp.isEmpty()) {
            return realIp;
        }
        return remoteAddress;
    }
}
