package com.coursehub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.coursehub.backend.global.error.FieldViolation;
import com.coursehub.backend.global.error.ProblemException;
import com.coursehub.backend.global.error.ValidationProblemException;
import com.coursehub.backend.global.web.InputSanitizer;
import com.coursehub.backend.global.web.RedirectTargets;
import com.coursehub.backend.modules.audit.application.SecurityEventLogger;
import com.coursehub.backend.modules.audit.domain.SecurityEventType;
import com.coursehub.backend.modules.auth.domain.CourseUser;
import com.coursehub.backend.modules.auth.infrastructure.persistence.CourseUserRepository;
import com.coursehub.backend.modules.auth.presentation.dto.LoginRequest;
import com.coursehub.backend.modules.auth.presentation.dto.LoginResponse;
import com.coursehub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.coursehub.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.coursehub.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.coursehub.backend.modules.session.application.SessionService;
import com.coursehub.backend.modules.session.domain.IssuedSession;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Service
@Transactional
public class AuthService {

    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String INVALID_RESET_TOKEN = "INVALID_RESET_TOKEN";

    static final String INVALID_CREDENTIALS_DETAIL = "Invalid username or password.";
    static final String INVALID_RESET_TOKEN_DETAIL = "Invalid or expired reset token.";

    private static final int USERNAME_MAX_LENGTH = 80;
    private static final int EMAIL_MAX_LENGTH = 120;
    private static final int TOKEN_MAX_LENGTH = 100;
    // Verified against when the user does not exist, so both paths cost one hash computation.
    private static final String DUMMY_PASSWORD = "dummy-password-for-timing";

    private final CourseUserRepository userRepository;
    private final CredentialService credentialService;
    private final PasswordResetTokenService resetTokenService;
    private final PasswordResetNotifier resetNotifier;
    private final RegistrationValidator registrationValidator;
    private final SessionService sessionService;
    private final SecurityEventLogger securityEventLogger;
    private final Clock clock;

    private volatile String dummyHash;

    public AuthService(
            CourseUserRepository userRepository,
            CredentialService credentialService,
            PasswordResetTokenService resetTokenService,
            PasswordResetNotifier resetNotifier,
            RegistrationValidator registrationValidator,
            SessionService sessionService,
            SecurityEventLogger securityEventLogger,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.credentialService = credentialService;
        this.resetTokenService = resetTokenService;
        this.resetNotifier = resetNotifier;
        this.registrationValidator = registrationValidator;
        this.sessionService = sessionService;
        this.securityEventLogger = securityEventLogger;
        this.clock = clock;
    }

    public UserProfileResponse register(RegisterRequest request) {
        String username = InputSanitizer.sanitize(request.username(), USERNAME_MAX_LENGTH);
        String email = InputSanitizer.sanitize(request.email(), EMAIL_MAX_LENGTH).toLowerCase(Locale.ROOT);

        List<FieldViolation> violations = registrationValidator.validate(
                username, email, request.password(), request.passwordConfirm());
        if (!violations.isEmpty()) {
            throw new ValidationProblemException(violations);
        }

        CourseUser user = new CourseUser();
        user.setUsername(username);
        user.setEmail(email);
        user.setPasswordHash(credentialService.hash(request.password()));
        user.setActive(true);
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent registration with the same username or email
            throw new ProblemException(HttpStatus.CONFLICT, "ACCOUNT_ALREADY_EXISTS",
                    "Username or email address is already registered.", null, ex);
        }

        securityEventLogger.log(SecurityEventType.USER_REGISTERED, "User " + username + " registered", user.getId());
        return toProfile(user);
    }

    /**
     * Checks the credentials and starts a new session, discarding whatever {@code currentHandle}
     * pointed at. Every failure looks the same to the caller; the event log records the cause.
     */
    public LoginResult login(LoginRequest request, String currentHandle) {
        String identifier = InputSanitizer.sanitize(request.username(), EMAIL_MAX_LENGTH);
        Optional<CourseUser> found = userRepository.findByUsernameOrEmail(identifier);

        if (found.isEmpty()) {
            credentialService.verify(request.password(), dummyHash());
            throw rejectLogin("Failed login attempt for unknown user " + identifier, null);
        }
        CourseUser user = found.get();
        if (!credentialService.verify(request.password(), user.getPasswordHash())) {
            throw rejectLogin("Failed login attempt for " + identifier + ": wrong password", user.getId());
        }
        if (!user.isActive()) {
            throw rejectLogin("Failed login attempt for " + identifier + ": account inactive", user.getId());
        }

        user.setLastLoginAt(OffsetDateTime.now(clock));
        userRepository.saveAndFlush(user);

        IssuedSession session = sessionService.create(currentHandle, user.getId(), request.rememberMe());
        destroyOnRollback(session.handle());

        LoginResponse response = new LoginResponse(toProfile(user), RedirectTargets.afterLogin(request.next()));
        return new LoginResult(session, response);
    }

    public void logout(String handle) {
        sessionService.destroy(handle);
    }

    /**
     * Issues a reset token when the address belongs to a user. The outcome is never reported back.
     */
    public void forgotPassword(String rawEmail) {
        String email = InputSanitizer.sanitize(rawEmail, EMAIL_MAX_LENGTH).toLowerCase(Locale.ROOT);
        if (email.isEmpty()) {
            return;
        }
        userRepository.findByEmail(email).ifPresent(user -> {
            String token = resetTokenService.issue(user);
            resetNotifier.notifyResetRequested(user, token);
            securityEventLogger.log(SecurityEventType.PASSWORD_RESET_REQUESTED,
                    "Password reset requested for user " + user.getId(), user.getId());
        });
    }

    /**
     * Verifies the token, replaces the hash and clears the token in one transaction; the owner row
     * is locked so a token cannot be spent twice.
     */
    public void resetPassword(ResetPasswordRequest request) {
        List<FieldViolation> violations = registrationValidator.validatePassword(
                request.password(), request.passwordConfirm());
        if (!violations.isEmpty()) {
            throw new ValidationProblemException(violations);
        }

        String token = InputSanitizer.sanitize(request.token(), TOKEN_MAX_LENGTH);
        CourseUser user = token.isEmpty()
                ? null
                : userRepository.findByResetTokenForUpdate(token).orElse(null);
        if (user == null || !resetTokenService.verify(user, token)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, INVALID_RESET_TOKEN, INVALID_RESET_TOKEN_DETAIL);
        }

        user.setPasswordHash(credentialService.hash(request.password()));
        resetTokenService.clear(user);
        securityEventLogger.log(SecurityEventType.PASSWORD_RESET_COMPLETED,
                "Password reset completed for user " + user.getId(), user.getId());
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(long userId) {
        CourseUser user = userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        return toProfile(user);
    }

    private ProblemException rejectLogin(String details, Long userId) {
        securityEventLogger.log(SecurityEventType.FAILED_LOGIN_ATTEMPT, details, userId);
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS, INVALID_CREDENTIALS_DETAIL);
    }

    // The session store is not transactional; a session whose login rolled back never reaches a cookie.
    private void destroyOnRollback(String handle) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED) {
                    sessionService.destroy(handle);
                }
            }
        });
    }

    private String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            hash = credentialService.hash(DUMMY_PASSWORD);
            dummyHash = hash;
        }
        return hash;
    }

    private static UserProfileResponse toProfile(CourseUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getLastLoginAt(),
                user.getCreatedAt()
        );
    }
}
