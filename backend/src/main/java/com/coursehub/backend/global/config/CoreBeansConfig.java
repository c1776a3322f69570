package com.coursehub.backend.global.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared time and randomness sources. Every expiry decision in the core reads the same UTC clock,
 * and every opaque token (session handle, session token, reset token) is drawn from the same generator.
 */
@Configuration
public class CoreBeansConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
