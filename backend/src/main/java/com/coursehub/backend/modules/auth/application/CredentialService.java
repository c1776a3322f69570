package com.coursehub.backend.modules.auth.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.coursehub.backend.modules.auth.domain.PasswordPolicy;
import com.coursehub.backend.modules.auth.domain.PasswordStrength;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Password hashing, verification and strength scoring.
 */
@Service
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    static final String SYMBOLS = "!@#$%^&*()_+-=[]{}|;:,.<>?";
    static final List<String> COMMON_PATTERNS = List.of("123", "abc", "password", "admin", "user");

    private final PasswordEncoder passwordEncoder;

    public CredentialService(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Salted, iterated, algorithm-tagged hash. Two calls with the same input differ.
     */
    public String hash(String password) {
        Objects.requireNonNull(password, "password");
        return passwordEncoder.encode(password);
    }

    /**
     * Constant-time check of {@code password} against {@code hash}. Any malformed, empty or
     * unknown-algorithm input yields {@code false}.
     */
    public boolean verify(String password, String hash) {
        if (password == null || password.isEmpty() || hash == null || hash.isEmpty()) {
            return false;
        }
        try {
            return passwordEncoder.matches(password, hash);
        } catch (RuntimeException ex) {
            log.debug("Stored hash could not be checked: {}", ex.getClass().getSimpleName());
            return false;
        }
    }

    public PasswordStrength scoreStrength(String password) {
        String candidate = password != null ? password : "";
        int score = 0;
        List<String> feedback = new ArrayList<>();

        if (candidate.length() >= PasswordPolicy.MIN_LENGTH) {
            score++;
        } else {
            feedback.add("Password should be at least 8 characters long");
        }

        if (candidate.chars().anyMatch(Character::isUpperCase)) {
            score++;
        } else {
            feedback.add("Password should contain at least one uppercase letter");
        }

        if (candidate.chars().anyMatch(Character::isLowerCase)) {
            score++;
        } else {
            feedback.add("Password should contain at least one lowercase letter");
        }

        if (candidate.chars().anyMatch(Character::isDigit)) {
            score++;
        } else {
            feedback.add("Password should contain at least one number");
        }

        if (candidate.chars().anyMatch(c -> SYMBOLS.indexOf(c) >= 0)) {
            score++;
        } else {
            feedback.add("Password should contain at least one special character");
        }

        String lowered = candidate.toLowerCase(Locale.ROOT);
        if (COMMON_PATTERNS.stream().anyMatch(lowered::contains)) {
            score--;
            feedback.add("Password should not contain common patterns");
        }

        return new PasswordStrength(Math.max(0, score), feedback, score >= PasswordStrength.STRONG_THRESHOLD);
    }

    /**
     * Hard policy messages; empty when the password is acceptable.
     */
    public List<String> checkPolicy(String password) {
        return PasswordPolicy.violations(password);
    }
}
