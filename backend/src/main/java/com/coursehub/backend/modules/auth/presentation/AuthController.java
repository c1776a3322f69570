package com.coursehub.backend.modules.auth.presentation;

import com.coursehub.backend.global.security.SecurityUtils;
import com.coursehub.backend.global.security.SessionCookieManager;
import com.coursehub.backend.modules.auth.application.AuthService;
import com.coursehub.backend.modules.auth.application.CredentialService;
import com.coursehub.backend.modules.auth.application.LoginResult;
import com.coursehub.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.coursehub.backend.modules.auth.presentation.dto.LoginRequest;
import com.coursehub.backend.modules.auth.presentation.dto.LoginResponse;
import com.coursehub.backend.modules.auth.presentation.dto.MessageResponse;
import com.coursehub.backend.modules.auth.presentation.dto.PasswordStrengthRequest;
import com.coursehub.backend.modules.auth.presentation.dto.PasswordStrengthResponse;
import com.coursehub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.coursehub.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.coursehub.backend.modules.auth.presentation.dto.SessionStatusResponse;
import com.coursehub.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    static final String FORGOT_PASSWORD_MESSAGE =
            "If that email address is in our system, you will receive reset instructions.";
    static final String RESET_PASSWORD_MESSAGE = "Your password has been reset. You can now log in.";

    private final AuthService authService;
    private final CredentialService credentialService;
    private final SessionCookieManager cookieManager;

    public AuthController(AuthService authService,
                          CredentialService credentialService,
                          SessionCookieManager cookieManager) {
        this.authService = authService;
        this.credentialService = credentialService;
        this.cookieManager = cookieManager;
    }

    @PostMapping("/auth/register")
    public ResponseEntity<UserProfileResponse> register(@RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest,
                                               HttpServletResponse httpResponse) {
        LoginResult result = authService.login(request, cookieManager.extract(httpRequest));
        cookieManager.write(httpResponse, result.session());
        return ResponseEntity.ok(result.response());
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        authService.logout(cookieManager.extract(httpRequest));
        cookieManager.clear(httpResponse);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/auth/session")
    public ResponseEntity<SessionStatusResponse> session() {
        SessionStatusResponse status = SecurityUtils.findCurrentPrincipal()
                .map(principal -> new SessionStatusResponse(true, principal.userId(), principal.loginTime()))
                .orElseGet(SessionStatusResponse::anonymous);
        return ResponseEntity.ok(status);
    }

    @PostMapping("/auth/forgot-password")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        authService.forgotPassword(request.email());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new MessageResponse(FORGOT_PASSWORD_MESSAGE));
    }

    @PostMapping("/auth/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@RequestBody ResetPasswordRequest request) {
        authService.resetPassword(request);
        return ResponseEntity.ok(new MessageResponse(RESET_PASSWORD_MESSAGE));
    }

    @PostMapping("/auth/password-strength")
    public ResponseEntity<PasswordStrengthResponse> passwordStrength(@RequestBody PasswordStrengthRequest request) {
        return ResponseEntity.ok(PasswordStrengthResponse.from(credentialService.scoreStrength(request.password())));
    }
}
