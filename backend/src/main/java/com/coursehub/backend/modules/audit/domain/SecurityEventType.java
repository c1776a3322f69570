package com.coursehub.backend.modules.audit.domain;

/**
 * Event type names emitted by the core. Callers may log other types as plain strings.
 */
public final class SecurityEventType {

    public static final String FAILED_LOGIN_ATTEMPT = "failed_login_attempt";
    public static final String USER_LOGIN = "user_login";
    public static final String USER_LOGOUT = "user_logout";
    public static final String USER_REGISTERED = "user_registered";
    public static final String PASSWORD_RESET_REQUESTED = "password_reset_requested";
    public static final String PASSWORD_RESET_COMPLETED = "password_reset_completed";
    public static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";

    private SecurityEventType() {
    }
}
