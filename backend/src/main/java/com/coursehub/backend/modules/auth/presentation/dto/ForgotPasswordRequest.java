package com.coursehub.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record ForgotPasswordRequest(
        @NotBlank(message = "email is required")
        @Email(message = "Please enter a valid email address.")
        String email
) {
}
