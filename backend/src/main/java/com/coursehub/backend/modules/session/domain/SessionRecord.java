package com.coursehub.backend.modules.session.domain;

import java.time.Instant;

/**
 * Server-side state of one login. The client only ever holds the opaque handle that keys it.
 *
 * @param userId        the authenticated user
 * @param loginTime     when the session was created
 * @param lastActivity  last validated request; never moves backwards
 * @param sessionToken  random server-generated token, never client-settable
 * @param permanent     "remember me": the cookie outlives the browser session
 */
public record SessionRecord(
        long userId,
        Instant loginTime,
        Instant lastActivity,
        String sessionToken,
        boolean permanent
) {

    public SessionRecord touchedAt(Instant now) {
        if (!now.isAfter(lastActivity)) {
            return this;
        }
        return new SessionRecord(userId, loginTime, now, sessionToken, permanent);
    }
}
