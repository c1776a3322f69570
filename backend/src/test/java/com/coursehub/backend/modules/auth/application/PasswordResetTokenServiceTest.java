package com.coursehub.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;

import com.coursehub.backend.global.security.OpaqueTokenGenerator;
import com.coursehub.backend.modules.auth.domain.CourseUser;
import com.coursehub.backend.modules.auth.infrastructure.persistence.CourseUserRepository;
import com.coursehub.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PasswordResetTokenServiceTest {

    private CourseUserRepository userRepository;
    private MutableClock clock;
    private PasswordResetTokenService tokenService;
    private CourseUser user;

    @BeforeEach
    void setUp() {
        userRepository = mock(CourseUserRepository.class);
        when(userRepository.save(any(CourseUser.class))).thenAnswer(invocation -> invocation.getArgument(0));
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        tokenService = new PasswordResetTokenService(
                userRepository,
                new OpaqueTokenGenerator(new SecureRandom()),
                clock,
                Duration.ofHours(1)
        );
        user = new CourseUser();
        user.setUsername("validUser1");
        user.setEmail("valid@example.com");
        user.setPasswordHash("{pbkdf2}00");
    }

    @Test
    void issuedTokenIsUrlSafeAndCarriesAtLeast32Bytes() {
        String token = tokenService.issue(user);

        assertThat(token).matches("[A-Za-z0-9_-]+");
        assertThat(Base64.getUrlDecoder().decode(token)).hasSizeGreaterThanOrEqualTo(32);
        assertThat(user.getResetToken()).isEqualTo(token);
        assertThat(user.getResetTokenExpiresAt().toInstant()).isEqualTo(clock.instant().plus(Duration.ofHours(1)));
        verify(userRepository).save(user);
    }

    @Test
    void tokenIsValidUntilJustBeforeExpiry() {
        String token = tokenService.issue(user);

        clock.advance(Duration.ofHours(1).minusSeconds(1));
        assertThat(tokenService.verify(user, token)).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(tokenService.verify(user, token)).isFalse();

        clock.advance(Duration.ofHours(1));
        assertThat(tokenService.verify(user, token)).isFalse();
    }

    @Test
    void reissuingInvalidatesPreviousToken() {
        String first = tokenService.issue(user);
        String second = tokenService.issue(user);

        assertThat(first).isNotEqualTo(second);
        assertThat(tokenService.verify(user, first)).isFalse();
        assertThat(tokenService.verify(user, second)).isTrue();
    }

    @Test
    void verifyDoesNotConsumeToken() {
        String token = tokenService.issue(user);

        assertThat(tokenService.verify(user, token)).isTrue();
        assertThat(tokenService.verify(user, token)).isTrue();
        assertThat(user.getResetToken()).isEqualTo(token);
    }

    @Test
    void clearedTokenNoLongerVerifies() {
        String token = tokenService.issue(user);

        tokenService.clear(user);

        assertThat(user.getResetToken()).isNull();
        assertThat(user.getResetTokenExpiresAt()).isNull();
        assertThat(tokenService.verify(user, token)).isFalse();
    }

    @Test
    void clearIsIdempotent() {
        tokenService.clear(user);
        tokenService.clear(user);

        verify(userRepository, never()).save(any(CourseUser.class));
    }

    @Test
    void mismatchedOrEmptyTokenIsRejected() {
        String token = tokenService.issue(user);

        assertThat(tokenService.verify(user, token + "x")).isFalse();
        assertThat(tokenService.verify(user, "")).isFalse();
        assertThat(tokenService.verify(user, null)).isFalse();
        assertThat(tokenService.verify(new CourseUser(), token)).isFalse();
    }
}
