package com.coursehub.backend.modules.auth.application;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.coursehub.backend.global.error.FieldViolation;
import com.coursehub.backend.modules.auth.domain.PasswordPolicy;
import com.coursehub.backend.modules.auth.infrastructure.persistence.CourseUserRepository;

import org.springframework.stereotype.Component;

/**
 * Hard registration checks. Every failing field is reported, not just the first.
 * Expects sanitised input with the email already lowercased.
 */
@Component
public class RegistrationValidator {

    static final int USERNAME_MIN_LENGTH = 4;
    static final int USERNAME_MAX_LENGTH = 20;

    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9_]+$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final CourseUserRepository userRepository;

    public RegistrationValidator(CourseUserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public List<FieldViolation> validate(String username, String email, String password, String passwordConfirm) {
        List<FieldViolation> violations = new ArrayList<>();
        validateUsername(username, violations);
        validateEmail(email, violations);
        validatePassword(password, passwordConfirm, violations);
        return violations;
    }

    /**
     * Password rules shared by registration and password reset.
     */
    public List<FieldViolation> validatePassword(String password, String passwordConfirm) {
        List<FieldViolation> violations = new ArrayList<>();
        validatePassword(password, passwordConfirm, violations);
        return violations;
    }

    private void validateUsername(String username, List<FieldViolation> violations) {
        if (username.isEmpty()) {
            violations.add(new FieldViolation("username", "Username is required."));
            return;
        }
        if (username.length() < USERNAME_MIN_LENGTH || username.length() > USERNAME_MAX_LENGTH) {
            violations.add(new FieldViolation("username", "Username must be between 4 and 20 characters."));
        }
        if (!USERNAME.matcher(username).matches()) {
            violations.add(new FieldViolation("username", "Username can only contain letters, numbers, and underscores."));
        } else if (userRepository.existsByUsername(username)) {
            violations.add(new FieldViolation("username", "Username already exists. Please choose a different one."));
        }
    }

    private void validateEmail(String email, List<FieldViolation> violations) {
        if (email.isEmpty()) {
            violations.add(new FieldViolation("email", "Email is required."));
            return;
        }
        if (!EMAIL.matcher(email).matches()) {
            violations.add(new FieldViolation("email", "Please enter a valid email address."));
        } else if (userRepository.existsByEmail(email)) {
            violations.add(new FieldViolation("email", "Email address already registered. Please use a different email."));
        }
    }

    private void validatePassword(String password, String passwordConfirm, List<FieldViolation> violations) {
        if (password == null || password.isEmpty()) {
            violations.add(new FieldViolation("password", "Password is required."));
        } else {
            PasswordPolicy.violations(password)
                    .forEach(message -> violations.add(new FieldViolation("password", message)));
        }
        if (passwordConfirm == null || passwordConfirm.isEmpty()) {
            violations.add(new FieldViolation("passwordConfirm", "Please confirm your password."));
        } else if (!passwordConfirm.equals(password)) {
            violations.add(new FieldViolation("passwordConfirm", "Passwords must match."));
        }
    }
}
