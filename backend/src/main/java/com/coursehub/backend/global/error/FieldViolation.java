package com.coursehub.backend.global.error;

public record FieldViolation(String field, String message) {
}
