package com.example.authservice.controller;

import com.example.authservice.dto.*;
import com.example.authservice.entity.User;
import com.example.authservice.security.SecurityContextHelper;
import com.example.authservice.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Authentication controller.
 */
@RestController
@RequestMapping("/api/auth")
@Tag(name = "Authentication", description = "Login, tokens, sessions, password reset, email verification")
public class AuthController {

    private final AuthService authService;
    private final SecurityContextHelper securityContextHelper;

    public AuthController(AuthService authService, SecurityContextHelper securityContextHelper) {
        this.authService = authService;
        this.securityContextHelper = securityContextHelper;
    }

    /**
     * POST /api/auth/login
     *
     * @return 200 OK with access and refresh tokens
     */
    @Operation(
            summary = "Login",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Authenticated"),
                    @ApiResponse(responseCode = "401", description = "Invalid email or password"),
                    @ApiResponse(responseCode = "403", description = "Account locked or inactive")
            }
    )
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest) {
        LoginResponse response = authService.login(
                request.email(), request.password(), request.rememberMeOrDefault(), RequestMeta.from(httpRequest));
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/auth/refresh
     * The refresh token is not rotated; only a new access token is returned.
     */
    @Operation(
            summary = "Refresh access token",
            responses = {
                    @ApiResponse(responseCode = "200", description = "New access token"),
                    @ApiResponse(responseCode = "401", description = "Invalid or expired token")
            }
    )
    @PostMapping("/refresh")
    public ResponseEntity<RefreshTokenResponse> refresh(@Valid @RequestBody RefreshTokenRequest request,
                                                        HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.refreshAccessToken(request.refreshToken(), RequestMeta.from(httpRequest)));
    }

    /**
     * POST /api/auth/logout
     *
     * Idempotent: revoking an unknown or already revoked token still answers 200.
     */
    @Operation(summary = "Logout current session or all devices")
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(@RequestBody(required = false) LogoutRequest request,
                                                  HttpServletRequest httpRequest) {
        User user = securityContextHelper.requireCurrentUser();
        String refreshToken = request != null ? request.refreshToken() : null;
        boolean allDevices = request != null && request.allDevices();

        int revoked = authService.logout(user, refreshToken, allDevices, RequestMeta.from(httpRequest));
        return ResponseEntity.ok(MessageResponse.of(
                allDevices || refreshToken == null
                        ? String.format("Logged out from %d session(s)", revoked)
                        : "Logged out successfully"));
    }

    @Operation(summary = "Current user profile")
    @GetMapping("/me")
    public ResponseEntity<UserDto> me() {
        return ResponseEntity.ok(UserDto.fromEntity(securityContextHelper.requireCurrentUser()));
    }

    /**
     * POST /api/auth/verify-token
     * Introspection for other services: returns the identity claims of a valid access token.
     */
    @Operation(summary = "Verify access token")
    @PostMapping("/verify-token")
    public ResponseEntity<UserClaims> verifyToken(@Valid @RequestBody VerifyTokenRequest request) {
        return ResponseEntity.ok(authService.verifyAccessToken(request.token()));
    }

    /**
     * POST /api/auth/password-reset
     * Same answer whether or not the email is registered.
     */
    @Operation(summary = "Request password reset")
    @PostMapping("/password-reset")
    public ResponseEntity<MessageResponse> requestPasswordReset(@Valid @RequestBody PasswordResetRequestDto request,
                                                                HttpServletRequest httpRequest) {
        authService.requestPasswordReset(request.email(), RequestMeta.from(httpRequest));
        return ResponseEntity.ok(MessageResponse.of(
                "If an account with that email exists, a password reset link has been sent"));
    }

    @Operation(
            summary = "Confirm password reset",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Password reset"),
                    @ApiResponse(responseCode = "400", description = "Weak password"),
                    @ApiResponse(responseCode = "401", description = "Invalid, expired or used token")
            }
    )
    @PostMapping("/password-reset/confirm")
    public ResponseEntity<MessageResponse> confirmPasswordReset(@Valid @RequestBody PasswordResetConfirmRequest request,
                                                                HttpServletRequest httpRequest) {
        authService.confirmPasswordReset(request.token(), request.newPassword(), RequestMeta.from(httpRequest));
        return ResponseEntity.ok(MessageResponse.of("Password has been reset successfully"));
    }

    @Operation(summary = "Verify email address")
    @PostMapping("/verify-email")
    public ResponseEntity<UserDto> verifyEmail(@Valid @RequestBody VerifyEmailRequest request,
                                               HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.verifyEmail(request.token(), RequestMeta.from(httpRequest)));
    }

    @Operation(summary = "Resend email verification")
    @PostMapping("/verify-email/resend")
    public ResponseEntity<MessageResponse> resendEmailVerification() {
        User user = securityContextHelper.requireCurrentUser();
        if (user.isVerified()) {
            return ResponseEntity.ok(MessageResponse.of("Email is already verified"));
        }
        authService.sendEmailVerification(user);
        return ResponseEntity.ok(MessageResponse.of("Verification email sent"));
    }

    // ==================== Sessions ====================

    @Operation(summary = "List active sessions of the current user")
    @GetMapping("/sessions")
    public ResponseEntity<List<SessionDto>> listSessions() {
        User user = securityContextHelper.requireCurrentUser();
        UUID current = securityContextHelper.getCurrentSessionId().orElse(null);
        return ResponseEntity.ok(authService.listSessions(user).stream()
                .map(session -> SessionDto.fromEntity(session, current))
                .toList());
    }

    @Operation(
            summary = "Revoke one session of the current user",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Session revoked"),
                    @ApiResponse(responseCode = "404", description = "Session not found")
            }
    )
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<MessageResponse> revokeSession(
            @Parameter(description = "Session ID") @PathVariable("sessionId") UUID sessionId,
            HttpServletRequest httpRequest) {
        authService.revokeSession(securityContextHelper.requireCurrentUser(), sessionId, RequestMeta.from(httpRequest));
        return ResponseEntity.ok(MessageResponse.of("Session revoked successfully"));
    }
}
