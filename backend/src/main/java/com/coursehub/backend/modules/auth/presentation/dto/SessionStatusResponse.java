package com.coursehub.backend.modules.auth.presentation.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionStatusResponse(
        boolean authenticated,
        Long userId,
        Instant loginTime
) {

    public static SessionStatusResponse anonymous() {
        return new SessionStatusResponse(false, null, null);
    }
}
