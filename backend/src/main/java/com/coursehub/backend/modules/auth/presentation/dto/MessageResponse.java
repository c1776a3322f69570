package com.coursehub.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
