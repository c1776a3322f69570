package com.coursehub.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record UserProfileResponse(
        Long userId,
        String username,
        String email,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt
) {
}
