package com.coursehub.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A problem the client may retry after {@link #getRetryAfterSeconds()}.
 * Rendered with a {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, long retryAfterSeconds) {
        this(status, code, detail, retryAfterSeconds, null);
    }

    public RetryableProblemException(HttpStatus status, String code, String detail, long retryAfterSeconds, Throwable cause) {
        super(status, code, detail, null, cause);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RetryableProblemException(HttpStatus status, String code, long retryAfterSeconds) {
        this(status, code, null, retryAfterSeconds);
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
