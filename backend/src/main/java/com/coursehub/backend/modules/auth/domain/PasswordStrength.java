package com.coursehub.backend.modules.auth.domain;

import java.util.List;

/**
 * Advisory strength report.
 *
 * @param score    0..5, the raw score floored at zero
 * @param feedback reasons, in check order
 * @param strong   raw (unfloored) score is at least {@link #STRONG_THRESHOLD}
 */
public record PasswordStrength(int score, List<String> feedback, boolean strong) {

    public static final int STRONG_THRESHOLD = 4;

    public PasswordStrength {
        feedback = List.copyOf(feedback);
    }
}
