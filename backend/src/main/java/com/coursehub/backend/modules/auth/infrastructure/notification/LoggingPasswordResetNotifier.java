package com.coursehub.backend.modules.auth.infrastructure.notification;

import com.coursehub.backend.modules.auth.application.PasswordResetNotifier;
import com.coursehub.backend.modules.auth.domain.CourseUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier until a mail channel exists. The token itself is never logged.
 */
@Component
public class LoggingPasswordResetNotifier implements PasswordResetNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingPasswordResetNotifier.class);

    @Override
    public void notifyResetRequested(CourseUser user, String token) {
        log.info("Password reset notification requested for userId={}", user.getId());
    }
}
