package com.coursehub.backend.modules.auth.presentation.dto;

public record PasswordStrengthRequest(String password) {
}
