package com.coursehub.backend.global.security;

import java.time.Instant;

/**
 * Identity resolved from the session cookie, valid for one request.
 */
public record SessionPrincipal(
        long userId,
        String handle,
        Instant loginTime
) {
}
