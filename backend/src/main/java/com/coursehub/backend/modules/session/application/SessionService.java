package com.coursehub.backend.modules.session.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.coursehub.backend.global.security.OpaqueTokenGenerator;
import com.coursehub.backend.modules.audit.application.SecurityEventLogger;
import com.coursehub.backend.modules.audit.domain.SecurityEventType;
import com.coursehub.backend.modules.session.domain.IssuedSession;
import com.coursehub.backend.modules.session.domain.SessionRecord;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Session lifecycle: NoSession -> Active -> Destroyed.
 *
 * <p>Expiry is idle-based and detected lazily: {@link #resolve(String)} destroys a session whose
 * last activity is older than the idle timeout. There is no background sweep. Calls with a
 * missing or unknown handle are no-ops or report "no session".
 */
@Service
public class SessionService {

    private final SessionStore sessionStore;
    private final OpaqueTokenGenerator tokenGenerator;
    private final SecurityEventLogger securityEventLogger;
    private final Clock clock;
    private final Duration idleTimeout;

    public SessionService(
            SessionStore sessionStore,
            OpaqueTokenGenerator tokenGenerator,
            SecurityEventLogger securityEventLogger,
            Clock clock,
            @Value("${app.session.idle-timeout:PT24H}") Duration idleTimeout
    ) {
        this.sessionStore = sessionStore;
        this.tokenGenerator = tokenGenerator;
        this.securityEventLogger = securityEventLogger;
        this.clock = clock;
        this.idleTimeout = idleTimeout;
    }

    /**
     * Starts a session for {@code userId}. State bound to {@code previousHandle} is discarded
     * and a new handle is issued, so a handle known before login is useless after it.
     */
    public IssuedSession create(String previousHandle, long userId, boolean remember) {
        if (hasText(previousHandle)) {
            sessionStore.remove(previousHandle);
        }
        Instant now = clock.instant();
        SessionRecord record = new SessionRecord(userId, now, now, tokenGenerator.generate(), remember);
        String handle = tokenGenerator.generate();
        sessionStore.save(handle, record, idleTimeout);

        securityEventLogger.log(SecurityEventType.USER_LOGIN, "User " + userId + " logged in", userId);
        return new IssuedSession(handle, record);
    }

    public boolean isValid(String handle) {
        return resolve(handle).isPresent();
    }

    /**
     * Returns the live session for {@code handle}. An idle-expired session is destroyed and
     * reported as absent; it cannot come back.
     */
    public Optional<SessionRecord> resolve(String handle) {
        if (!hasText(handle)) {
            return Optional.empty();
        }
        Optional<SessionRecord> found = sessionStore.find(handle);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Duration idle = Duration.between(found.get().lastActivity(), clock.instant());
        if (idle.compareTo(idleTimeout) > 0) {
            destroy(handle);
            return Optional.empty();
        }
        return found;
    }

    /**
     * Records activity on a live session. Call after every successful validation of a request
     * that will be honoured.
     */
    public void touch(String handle) {
        if (!hasText(handle)) {
            return;
        }
        Instant now = clock.instant();
        sessionStore.update(handle, record -> record.touchedAt(now), idleTimeout);
    }

    public void destroy(String handle) {
        if (!hasText(handle)) {
            return;
        }
        sessionStore.remove(handle).ifPresent(record -> securityEventLogger.log(
                SecurityEventType.USER_LOGOUT, "User " + record.userId() + " logged out", record.userId()));
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    private static boolean hasText(String handle) {
        return handle != null && !handle.isBlank();
    }
}
