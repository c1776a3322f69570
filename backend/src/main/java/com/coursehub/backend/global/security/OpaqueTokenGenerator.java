package com.coursehub.backend.global.security;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

/**
 * Random, URL-safe, unpadded Base64 tokens with no decodable structure.
 */
@Component
public class OpaqueTokenGenerator {

    public static final int DEFAULT_BYTES = 32;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom secureRandom;

    public OpaqueTokenGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public String generate() {
        return generate(DEFAULT_BYTES);
    }

    public String generate(int entropyBytes) {
        if (entropyBytes < 16) {
            throw new IllegalArgumentException("entropyBytes must be >= 16");
        }
        byte[] bytes = new byte[entropyBytes];
        secureRandom.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
