package com.coursehub.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.coursehub.backend.global.security.OpaqueTokenGenerator;
import com.coursehub.backend.modules.auth.domain.CourseUser;
import com.coursehub.backend.modules.auth.infrastructure.persistence.CourseUserRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * One-time password-reset tokens stored on the user record.
 *
 * <p>A user holds at most one live token; issuing a new one overwrites the old. {@link #verify}
 * never consumes the token, the caller clears it after a successful reset.
 */
@Service
public class PasswordResetTokenService {

    private final CourseUserRepository userRepository;
    private final OpaqueTokenGenerator tokenGenerator;
    private final Clock clock;
    private final Duration tokenTtl;

    public PasswordResetTokenService(
            CourseUserRepository userRepository,
            OpaqueTokenGenerator tokenGenerator,
            Clock clock,
            @Value("${app.auth.reset-token.ttl:PT1H}") Duration tokenTtl
    ) {
        this.userRepository = userRepository;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
        this.tokenTtl = tokenTtl;
    }

    public String issue(CourseUser user) {
        String token = tokenGenerator.generate(OpaqueTokenGenerator.DEFAULT_BYTES);
        user.setResetToken(token);
        user.setResetTokenExpiresAt(OffsetDateTime.now(clock).plus(tokenTtl));
        userRepository.save(user);
        return token;
    }

    public boolean verify(CourseUser user, String token) {
        String stored = user.getResetToken();
        OffsetDateTime expiresAt = user.getResetTokenExpiresAt();
        if (stored == null || expiresAt == null || token == null || token.isEmpty()) {
            return false;
        }
        boolean matches = MessageDigest.isEqual(
                stored.getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8)
        );
        return matches && OffsetDateTime.now(clock).isBefore(expiresAt);
    }

    public void clear(CourseUser user) {
        if (user.getResetToken() == null && user.getResetTokenExpiresAt() == null) {
            return;
        }
        user.setResetToken(null);
        user.setResetTokenExpiresAt(null);
        userRepository.save(user);
    }

    public Duration getTokenTtl() {
        return tokenTtl;
    }
}
