package com.coursehub.backend.global.web;

public record ClientContext(String ipAddress, String userAgent) {

    public static final String UNKNOWN = "Unknown";

    public static ClientContext unknown() {
        return new ClientContext(UNKNOWN, UNKNOWN);
    }
}
