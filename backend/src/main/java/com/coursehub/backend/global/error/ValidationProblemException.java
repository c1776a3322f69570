package com.coursehub.backend.global.error;

import java.util.List;

import org.springframework.http.HttpStatus;

/**
 * Input rejected by a hard validation policy. Carries every violated field so the caller can
 * show all messages at once.
 */
public class ValidationProblemException extends ProblemException {

    public static final String CODE = "VALIDATION_FAILED";

    private final List<FieldViolation> violations;

    public ValidationProblemException(List<FieldViolation> violations) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, CODE, "Please correct the highlighted fields.");
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations must not be empty");
        }
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }
}
