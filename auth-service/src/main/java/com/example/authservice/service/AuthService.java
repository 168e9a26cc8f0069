package com.example.authservice.service;

import com.example.authservice.dto.*;
import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.entity.PasswordResetRequest;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.entity.UserSession;
import com.example.authservice.exception.AccountInactiveException;
import com.example.authservice.exception.AccountLockedException;
import com.example.authservice.exception.InvalidCredentialsException;
import com.example.authservice.exception.InvalidTokenException;
import com.example.authservice.notification.NotificationSender;
import com.example.authservice.repository.PasswordResetRequestRepository;
import com.example.authservice.repository.UserRepository;
import com.example.authservice.security.TokenKind;
import com.example.authservice.security.TokenVerification;
import io.jsonwebtoken.Claims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Authentication orchestration: login, refresh, logout, password reset,
 * email verification and access token resolution.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordResetRequestRepository passwordResetRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final PasswordPolicyService passwordPolicy;
    private final AccountLockoutService lockoutService;
    private final SessionService sessionService;
    private final AuditService auditService;
    private final NotificationSender notificationSender;
    private final Clock clock;

    // Compared against when the email is unknown, so both paths pay one BCrypt verification
    private final String dummyPasswordHash;

    public AuthService(
            UserRepository userRepository,
            PasswordResetRequestRepository passwordResetRepository,
            PasswordEncoder passwordEncoder,
            JwtService jwtService,
            PasswordPolicyService passwordPolicy,
            AccountLockoutService lockoutService,
            SessionService sessionService,
            AuditService auditService,
            NotificationSender notificationSender,
            Clock clock) {
        this.userRepository = userRepository;
        this.passwordResetRepository = passwordResetRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.passwordPolicy = passwordPolicy;
        this.lockoutService = lockoutService;
        this.sessionService = sessionService;
        this.auditService = auditService;
        this.notificationSender = notificationSender;
        this.clock = clock;
        this.dummyPasswordHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    /**
     * Authenticate and open a session.
     *
     * Order: lookup, lockout/active check, password verification, bookkeeping, session.
     * The failure path commits (counter increment, lock) while the caller still gets a typed error.
     *
     * @throws InvalidCredentialsException unknown email or wrong password (same message)
     * @throws AccountLockedException      account locked, even with the correct password
     * @throws AccountInactiveException    account deactivated
     */
    @Transactional(noRollbackFor = {
            InvalidCredentialsException.class,
            AccountLockedException.class,
            AccountInactiveException.class})
    public LoginResponse login(String email, String password, boolean rememberMe, RequestMeta meta) {
        String normalizedEmail = normalizeEmail(email);

        Optional<User> found = userRepository.findByEmail(normalizedEmail);
        if (found.isEmpty()) {
            passwordEncoder.matches(password, dummyPasswordHash);
            auditService.record(AuditAction.LOGIN_FAILED, AuditService.RESOURCE_USER, null, null,
                    null, Map.of("email", normalizedEmail, "reason", "unknown_email"),
                    AuditLog.AuditOutcome.FAILURE, meta);
            throw new InvalidCredentialsException();
        }
        User user = found.get();

        try {
            lockoutService.checkCanAuthenticate(user);
        } catch (AccountLockedException | AccountInactiveException e) {
            log.warn("Login denied for user {}: {}", user.getId(), e.getCode());
            auditService.record(AuditAction.LOGIN_DENIED, AuditService.RESOURCE_USER, user.getId().toString(),
                    user, null, Map.of("reason", e.getCode()), AuditLog.AuditOutcome.DENIED, meta);
            throw e;
        }

        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            lockoutService.recordFailedAttempt(user, meta);
            auditService.record(AuditAction.LOGIN_FAILED, AuditService.RESOURCE_USER, user.getId().toString(),
                    user, null, Map.of("email", normalizedEmail, "reason", "invalid_password"),
                    AuditLog.AuditOutcome.FAILURE, meta);
            throw new InvalidCredentialsException();
        }

        User authenticated = lockoutService.recordSuccessfulAuthentication(user);
        IssuedTokens tokens = sessionService.createSession(authenticated, rememberMe, meta);

        auditService.record(AuditAction.LOGIN_SUCCESSFUL, AuditService.RESOURCE_USER,
                authenticated.getId().toString(), authenticated, null,
                Map.of("sessionId", tokens.sessionId().toString(), "rememberMe", rememberMe), meta);
        log.info("User {} logged in", authenticated.getId());

        return LoginResponse.of(tokens);
    }

    /**
     * Mint a new access token from a refresh token. The refresh token is not rotated.
     */
    @Transactional
    public RefreshTokenResponse refreshAccessToken(String refreshToken, RequestMeta meta) {
        SessionService.RefreshResult result = sessionService.refresh(refreshToken);

        auditService.record(AuditAction.TOKEN_REFRESHED, AuditService.RESOURCE_SESSION,
                result.sessionId().toString(), result.user(), null, null, meta);

        return RefreshTokenResponse.of(result.accessToken(), result.expiresInSeconds());
    }

    /**
     * Revoke the session holding {@code refreshToken}, or every session of the user
     * when {@code allDevices} is set or no token is given.
     *
     * @return number of sessions revoked
     */
    @Transactional
    public int logout(User user, String refreshToken, boolean allDevices, RequestMeta meta) {
        if (allDevices || refreshToken == null || refreshToken.isBlank()) {
            int revoked = sessionService.revokeAll(user);
            auditService.record(AuditAction.LOGOUT_ALL_DEVICES, AuditService.RESOURCE_USER,
                    user.getId().toString(), user, null, Map.of("sessionsRevoked", revoked), meta);
            return revoked;
        }

        boolean revoked = sessionService.revokeByToken(user, refreshToken);
        auditService.record(AuditAction.LOGOUT, AuditService.RESOURCE_USER,
                user.getId().toString(), user, null, Map.of("sessionsRevoked", revoked ? 1 : 0), meta);
        return revoked ? 1 : 0;
    }

    // ==================== Password reset ====================

    /**
     * Start a password reset. Returns normally whether or not the email is known,
     * so the caller cannot tell which emails exist.
     */
    @Transactional
    public void requestPasswordReset(String email, RequestMeta meta) {
        Optional<User> found = userRepository.findByEmail(normalizeEmail(email));
        if (found.isEmpty() || !found.get().isActive()) {
            log.debug("Password reset requested for unknown or inactive account");
            return;
        }
        User user = found.get();
        RequestMeta context = meta != null ? meta : RequestMeta.none();
        LocalDateTime now = LocalDateTime.now(clock);

        String token = jwtService.createPasswordResetToken(user);
        PasswordResetRequest request = new PasswordResetRequest();
        request.setUser(user);
        request.setToken(token);
        request.setCreatedAt(now);
        request.setExpiresAt(now.plus(jwtService.getPasswordResetTtl()));
        request.setIpAddress(context.ipAddress());
        request.setUserAgent(context.userAgent());
        passwordResetRepository.save(request);

        auditService.record(AuditAction.PASSWORD_RESET_REQUESTED, AuditService.RESOURCE_USER,
                user.getId().toString(), user, null, null, meta);

        try {
            notificationSender.sendPasswordReset(user, token);
        } catch (RuntimeException e) {
            log.warn("Failed to deliver password reset notification to user {}", user.getId(), e);
        }
    }

    /**
     * Redeem a reset token. Single use: marks the request used, invalidates the user's other
     * outstanding requests and revokes every session.
     *
     * @throws InvalidTokenException unknown, expired, already used or forged token
     */
    @Transactional
    public void confirmPasswordReset(String token, String newPassword, RequestMeta meta) {
        TokenVerification verification = jwtService.verifyToken(token, TokenKind.PASSWORD_RESET);
        if (!verification.isValid()) {
            throw new InvalidTokenException(verification.getFailure());
        }
        passwordPolicy.requireStrongPassword(newPassword);
        // Hash before taking the row lock
        String newHash = passwordEncoder.encode(newPassword);

        LocalDateTime now = LocalDateTime.now(clock);
        PasswordResetRequest request = passwordResetRepository.findByTokenForUpdate(token.trim())
                .filter(r -> r.isRedeemableAt(now))
                .orElseThrow(InvalidTokenException::new);

        User user = request.getUser();
        if (!user.getId().toString().equals(verification.getSubject()) || !user.isActive()) {
            throw new InvalidTokenException();
        }

        user.setPasswordHash(newHash);
        user.setPasswordChangedAt(now);
        user.setUpdatedAt(now);
        request.markUsed(now);
        int invalidated = passwordResetRepository.invalidateOutstanding(user, now);
        int revoked = sessionService.revokeAll(user);

        auditService.record(AuditAction.PASSWORD_RESET_COMPLETED, AuditService.RESOURCE_USER,
                user.getId().toString(), user, null,
                Map.of("sessionsRevoked", revoked, "resetRequestsInvalidated", invalidated), meta);
        log.info("Password reset completed for user {}", user.getId());
    }

    // ==================== Email verification ====================

    /**
     * Issue a verification token and hand it to the notification channel.
     */
    public void sendEmailVerification(User user) {
        String token = jwtService.createEmailVerificationToken(user);
        try {
            notificationSender.sendEmailVerification(user, token);
        } catch (RuntimeException e) {
            log.warn("Failed to deliver email verification to user {}", user.getId(), e);
        }
    }

    /**
     * Mark the token's user verified. The token must still match the user's current email.
     */
    @Transactional
    public UserDto verifyEmail(String token, RequestMeta meta) {
        TokenVerification verification = jwtService.verifyToken(token, TokenKind.EMAIL_VERIFICATION);
        if (!verification.isValid()) {
            throw new InvalidTokenException(verification.getFailure());
        }
        Claims claims = verification.getClaims();
        User user = userRepository.findById(parseUuid(claims.getSubject()))
                .filter(User::isActive)
                .orElseThrow(InvalidTokenException::new);
        if (!user.getEmail().equals(claims.get(JwtService.CLAIM_EMAIL, String.class))) {
            throw new InvalidTokenException();
        }

        if (!user.isVerified()) {
            LocalDateTime now = LocalDateTime.now(clock);
            user.setVerified(true);
            user.setEmailVerifiedAt(now);
            user.setUpdatedAt(now);
            userRepository.save(user);
            auditService.record(AuditAction.EMAIL_VERIFIED, AuditService.RESOURCE_USER,
                    user.getId().toString(), user, null, Map.of("email", user.getEmail()), meta);
        }
        return UserDto.fromEntity(user);
    }

    // ==================== Access tokens ====================

    /**
     * Verify an access token and extract its identity claims.
     *
     * @throws InvalidTokenException on any signature, kind, expiry or claim problem
     */
    public UserClaims verifyAccessToken(String token) {
        TokenVerification verification = jwtService.verifyToken(token, TokenKind.ACCESS);
        if (!verification.isValid()) {
            throw new InvalidTokenException(verification.getFailure());
        }
        Claims claims = verification.getClaims();
        try {
            String sessionId = claims.get(JwtService.CLAIM_SESSION_ID, String.class);
            return new UserClaims(
                    UUID.fromString(claims.getSubject()),
                    claims.get(JwtService.CLAIM_EMAIL, String.class),
                    Role.fromValue(claims.get(JwtService.CLAIM_ROLE, String.class)),
                    sessionId != null ? UUID.fromString(sessionId) : null);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException();
        }
    }

    /**
     * Resolve the user behind an access token: the user must exist, be active and not locked.
     */
    @Transactional(readOnly = true)
    public User resolveUser(String token) {
        return resolveUser(verifyAccessToken(token));
    }

    /**
     * Same checks as {@link #resolveUser(String)} for claims that were already verified.
     */
    @Transactional(readOnly = true)
    public User resolveUser(UserClaims claims) {
        User user = userRepository.findById(claims.userId())
                .orElseThrow(InvalidTokenException::new);
        if (!user.isActive()) {
            throw new AccountInactiveException();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (user.isLockedAt(now)) {
            throw AccountLockedException.forUser(user, now);
        }
        return user;
    }

    // ==================== Sessions ====================

    public List<UserSession> listSessions(User user) {
        return sessionService.listActiveSessions(user);
    }

    @Transactional
    public void revokeSession(User user, UUID sessionId, RequestMeta meta) {
        sessionService.revoke(user, sessionId);
        auditService.record(AuditAction.SESSION_REVOKED, AuditService.RESOURCE_SESSION,
                sessionId.toString(), user, null, null, meta);
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static UUID parseUuid(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidTokenException();
        }
    }
}
