package com.coursehub.backend.modules.auth.presentation.dto;

public record LoginResponse(
        UserProfileResponse user,
        String redirectTo
) {
}
