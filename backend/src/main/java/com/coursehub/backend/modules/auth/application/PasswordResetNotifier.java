package com.coursehub.backend.modules.auth.application;

import com.coursehub.backend.modules.auth.domain.CourseUser;

/**
 * Delivers a freshly issued reset token to its owner (mail, queue, ...).
 */
public interface PasswordResetNotifier {

    void notifyResetRequested(CourseUser user, String token);
}
