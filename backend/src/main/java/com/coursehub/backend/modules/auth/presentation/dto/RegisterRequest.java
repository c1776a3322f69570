package com.coursehub.backend.modules.auth.presentation.dto;

public record RegisterRequest(
        String username,
        String email,
        String password,
        String passwordConfirm
) {
}
