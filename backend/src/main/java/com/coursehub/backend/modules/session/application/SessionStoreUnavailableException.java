package com.coursehub.backend.modules.session.application;

import com.coursehub.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * Transient failure of the session store. Distinct from "session invalid": the client should
 * retry, not log in again.
 */
public class SessionStoreUnavailableException extends RetryableProblemException {

    public static final String CODE = "SESSION_STORE_UNAVAILABLE";
    static final long RETRY_AFTER_SECONDS = 5;

    public SessionStoreUnavailableException(Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, CODE, "Please try again later.", RETRY_AFTER_SECONDS, cause);
    }
}
