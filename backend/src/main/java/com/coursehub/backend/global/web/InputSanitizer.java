package com.coursehub.backend.global.web;

public final class InputSanitizer {

    public static final int DEFAULT_MAX_LENGTH = 255;

    private InputSanitizer() {
    }

    public static String sanitize(String input) {
        return sanitize(input, DEFAULT_MAX_LENGTH);
    }

    /**
     * Drops control characters (tab, newline and carriage return survive), truncates to
     * {@code maxLength} and trims. {@code null} becomes the empty string.
     */
    public static String sanitize(String input, int maxLength) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c >= 32 || c == '\t' || c == '\n' || c == '\r') {
                sb.append(c);
            }
        }
        String kept = sb.length() > maxLength ? sb.substring(0, maxLength) : sb.toString();
        return kept.trim();
    }
}
