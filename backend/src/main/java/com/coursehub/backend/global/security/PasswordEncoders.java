package com.coursehub.backend.global.security;

import java.util.HashMap;
import java.util.Map;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.DelegatingPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;

/**
 * Builds the password encoder used for stored credentials. Hashes are tagged with their
 * algorithm ({@code {pbkdf2}...}); new hashes use PBKDF2-HMAC-SHA256 with a random salt per call,
 * bcrypt hashes still verify.
 */
public final class PasswordEncoders {

    public static final String DEFAULT_ID = "pbkdf2";
    public static final int DEFAULT_SALT_LENGTH = 16;
    public static final int DEFAULT_ITERATIONS = 310_000;

    private PasswordEncoders() {
    }

    public static PasswordEncoder pbkdf2(int saltLength, int iterations) {
        Pbkdf2PasswordEncoder pbkdf2 = new Pbkdf2PasswordEncoder(
                "",
                saltLength,
                iterations,
                Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256
        );
        Map<String, PasswordEncoder> encoders = new HashMap<>();
        encoders.put(DEFAULT_ID, pbkdf2);
        encoders.put("bcrypt", new BCryptPasswordEncoder());
        return new DelegatingPasswordEncoder(DEFAULT_ID, encoders);
    }
}
