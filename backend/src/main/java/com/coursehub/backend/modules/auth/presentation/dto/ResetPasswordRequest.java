package com.coursehub.backend.modules.auth.presentation.dto;

public record ResetPasswordRequest(
        String token,
        String password,
        String passwordConfirm
) {
}
