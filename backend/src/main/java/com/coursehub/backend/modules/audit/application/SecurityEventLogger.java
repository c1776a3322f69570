package com.coursehub.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.coursehub.backend.global.web.ClientContext;
import com.coursehub.backend.global.web.ClientContextResolver;
import com.coursehub.backend.modules.audit.domain.SecurityEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records security-relevant events (failed logins, logins, logouts, ...) with the timestamp,
 * client address and user agent of the current request.
 *
 * <p>Never throws: a failing sink is reported on the operator log and the caller carries on.
 */
@Service
public class SecurityEventLogger {

    private static final Logger log = LoggerFactory.getLogger(SecurityEventLogger.class);

    private final List<SecurityEventSink> sinks;
    private final ClientContextResolver clientContextResolver;
    private final Clock clock;

    public SecurityEventLogger(List<SecurityEventSink> sinks, ClientContextResolver clientContextResolver, Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.clientContextResolver = clientContextResolver;
        this.clock = clock;
    }

    public void log(String eventType, String details) {
        log(eventType, details, null);
    }

    public void log(String eventType, String details, Long userId) {
        SecurityEvent event;
        try {
            ClientContext client = clientContextResolver.current();
            event = new SecurityEvent(OffsetDateTime.now(clock), eventType, details, userId,
                    client.ipAddress(), client.userAgent());
        } catch (RuntimeException ex) {
            log.warn("Could not build security event {}", eventType, ex);
            return;
        }
        for (SecurityEventSink sink : sinks) {
            try {
                sink.emit(event);
            } catch (RuntimeException ex) {
                log.warn("Security event sink {} failed for {}", sink.getClass().getSimpleName(), eventType, ex);
            }
        }
    }
}
