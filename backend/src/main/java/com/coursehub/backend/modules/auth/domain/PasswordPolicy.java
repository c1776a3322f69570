package com.coursehub.backend.modules.auth.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Hard password rules enforced at registration and reset. Symbols and common substrings are not
 * checked here; they only lower the advisory score.
 */
public final class PasswordPolicy {

    public static final int MIN_LENGTH = 8;

    private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");
    private static final Pattern LOWERCASE = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("[0-9]");

    private PasswordPolicy() {
    }

    public static List<String> violations(String password) {
        List<String> violations = new ArrayList<>();
        String candidate = password != null ? password : "";
        if (candidate.length() < MIN_LENGTH) {
            violations.add("Password must be at least 8 characters long.");
        }
        if (!UPPERCASE.matcher(candidate).find()) {
            violations.add("Password must contain at least one uppercase letter.");
        }
        if (!LOWERCASE.matcher(candidate).find()) {
            violations.add("Password must contain at least one lowercase letter.");
        }
        if (!DIGIT.matcher(candidate).find()) {
            violations.add("Password must contain at least one number.");
        }
        return violations;
    }

    public static boolean isSatisfiedBy(String password) {
        return violations(password).isEmpty();
    }
}
