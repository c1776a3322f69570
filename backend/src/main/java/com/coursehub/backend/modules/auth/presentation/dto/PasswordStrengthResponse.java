package com.coursehub.backend.modules.auth.presentation.dto;

import java.util.List;

import com.coursehub.backend.modules.auth.domain.PasswordStrength;

public record PasswordStrengthResponse(
        int score,
        List<String> feedback,
        boolean strong
) {

    public static PasswordStrengthResponse from(PasswordStrength strength) {
        return new PasswordStrengthResponse(strength.score(), strength.feedback(), strength.strong());
    }
}
