package com.coursehub.backend.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when the security-relevant settings are missing or unsafe.
 * The secure-cookie requirement only applies when the {@code prod} profile is active.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_PBKDF2_ITERATIONS = 100_000;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid security configuration: " + String.join("; ", problems));
        }
        log.info("Security configuration validated (profiles={})", Arrays.toString(environment.getActiveProfiles()));
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        String idleTimeout = environment.getProperty("app.session.idle-timeout", "PT24H");
        try {
            Duration timeout = DurationStyle.detectAndParse(idleTimeout);
            if (timeout.isNegative() || timeout.isZero()) {
                problems.add("app.session.idle-timeout must be positive");
            }
        } catch (IllegalArgumentException | DateTimeParseException ex) {
            problems.add("app.session.idle-timeout is not a duration: " + idleTimeout);
        }

        String iterations = environment.getProperty("app.auth.password.pbkdf2-iterations", "310000");
        try {
            if (Integer.parseInt(iterations.trim()) < MIN_PBKDF2_ITERATIONS) {
                problems.add("app.auth.password.pbkdf2-iterations must be at least " + MIN_PBKDF2_ITERATIONS);
            }
        } catch (NumberFormatException ex) {
            problems.add("app.auth.password.pbkdf2-iterations must be a number");
        }

        boolean production = Arrays.asList(environment.getActiveProfiles()).contains("prod");
        boolean secureCookie = environment.getProperty("app.session.cookie.secure", Boolean.class, false);
        if (production && !secureCookie) {
            problems.add("app.session.cookie.secure must be true in production");
        }
        return problems;
    }
}
