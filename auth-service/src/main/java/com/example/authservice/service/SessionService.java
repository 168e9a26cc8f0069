package com.example.authservice.service;

import com.example.authservice.dto.IssuedTokens;
import com.example.authservice.dto.RequestMeta;
import com.example.authservice.entity.User;
import com.example.authservice.entity.UserSession;
import com.example.authservice.exception.AccountInactiveException;
import com.example.authservice.exception.AccountLockedException;
import com.example.authservice.exception.InvalidTokenException;
import com.example.authservice.exception.ResourceNotFoundException;
import com.example.authservice.exception.SessionNotFoundException;
import com.example.authservice.repository.UserSessionRepository;
import com.example.authservice.security.TokenKind;
import com.example.authservice.security.TokenVerification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Session registry: one row per issued refresh token.
 *
 * Refresh does NOT rotate the refresh token; it only mints a new access token and
 * touches last_used_at. Revocation is a flag flip, sessions are never deleted here.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private static final int DEVICE_INFO_MAX = 255;

    private final UserSessionRepository sessionRepository;
    private final JwtService jwtService;
    private final Clock clock;

    public SessionService(UserSessionRepository sessionRepository, JwtService jwtService, Clock clock) {
        this.sessionRepository = sessionRepository;
        this.jwtService = jwtService;
        this.clock = clock;
    }

    /**
     * Persist a new session and mint its token pair.
     * rememberMe doubles the refresh token lifetime.
     */
    @Transactional
    public IssuedTokens createSession(User user, boolean rememberMe, RequestMeta meta) {
        RequestMeta context = meta != null ? meta : RequestMeta.none();
        Duration refreshTtl = rememberMe
                ? jwtService.getRefreshTokenTtl().multipliedBy(2)
                : jwtService.getRefreshTokenTtl();

        LocalDateTime now = LocalDateTime.now(clock);
        String refreshToken = jwtService.createRefreshToken(user.getId(), refreshTtl);

        UserSession session = new UserSession();
        session.setUser(user);
        session.setRefreshToken(refreshToken);
        session.setDeviceInfo(deviceInfo(context.userAgent()));
        session.setIpAddress(context.ipAddress());
        session.setUserAgent(context.userAgent());
        session.setCreatedAt(now);
        session.setLastUsedAt(now);
        session.setExpiresAt(now.plus(refreshTtl));
        session.setActive(true);
        session = sessionRepository.save(session);

        String accessToken = jwtService.createAccessToken(user, session.getId());
        log.info("Session {} created for user {}", session.getId(), user.getId());

        return new IssuedTokens(accessToken, refreshToken, session.getId(),
                jwtService.getAccessTokenTtl().toSeconds());
    }

    /**
     * Exchange a refresh token for a new access token.
     *
     * @throws InvalidTokenException    signature, kind or expiry check failed
     * @throws SessionNotFoundException no active unexpired session holds the token
     * @throws AccountInactiveException owner was deactivated
     * @throws AccountLockedException   owner is locked
     */
    @Transactional
    public RefreshResult refresh(String refreshToken) {
        TokenVerification verification = jwtService.verifyToken(refreshToken, TokenKind.REFRESH);
        if (!verification.isValid()) {
            log.debug("Refresh token rejected: {}", verification.getFailure());
            throw new InvalidTokenException(verification.getFailure());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        UserSession session = sessionRepository.findByRefreshToken(refreshToken.trim())
                .filter(s -> s.isUsableAt(now))
                .orElseThrow(() -> {
                    log.warn("Refresh refused: no usable session for presented token");
                    return new SessionNotFoundException();
                });

        User user = session.getUser();
        if (!user.getId().toString().equals(verification.getSubject())) {
            log.warn("Refresh refused: token subject does not own session {}", session.getId());
            throw new InvalidTokenException();
        }
        if (!user.isActive()) {
            throw new AccountInactiveException();
        }
        if (user.isLockedAt(now)) {
            throw AccountLockedException.forUser(user, now);
        }

        session.setLastUsedAt(now);
        String accessToken = jwtService.createAccessToken(user, session.getId());
        return new RefreshResult(user, session.getId(), accessToken, jwtService.getAccessTokenTtl().toSeconds());
    }

    /**
     * Revoke one session of the user.
     *
     * @throws ResourceNotFoundException when absent, already inactive or owned by someone else
     */
    @Transactional
    public void revoke(User user, UUID sessionId) {
        UserSession session = sessionRepository.findByIdAndUser(sessionId, user)
                .filter(UserSession::isActive)
                .orElseThrow(() -> ResourceNotFoundException.sessionNotFound(sessionId));
        session.revoke();
        log.info("Session {} revoked for user {}", sessionId, user.getId());
    }

    /**
     * Revoke the session holding this refresh token, if it belongs to the user.
     *
     * @return true when a session was deactivated
     */
    @Transactional
    public boolean revokeByToken(User user, String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return false;
        }
        return sessionRepository.findByRefreshToken(refreshToken.trim())
                .filter(UserSession::isActive)
                .filter(s -> s.getUser().getId().equals(user.getId()))
                .map(s -> {
                    s.revoke();
                    log.info("Session {} revoked for user {}", s.getId(), user.getId());
                    return true;
                })
                .orElse(false);
    }

    /**
     * Deactivate every active session of the user. Idempotent.
     *
     * @return number of sessions deactivated by this call
     */
    @Transactional
    public int revokeAll(User user) {
        int revoked = sessionRepository.revokeAllByUser(user);
        if (revoked > 0) {
            log.warn("Revoked {} session(s) for user {}", revoked, user.getId());
        }
        return revoked;
    }

    @Transactional(readOnly = true)
    public List<UserSession> listActiveSessions(User user) {
        return sessionRepository.findUsableByUser(user, LocalDateTime.now(clock));
    }

    /**
     * Deactivate sessions whose refresh token has expired.
     *
     * @return number of sessions deactivated
     */
    @Transactional
    public int sweepExpired() {
        return sessionRepository.deactivateExpired(LocalDateTime.now(clock));
    }

    private static String deviceInfo(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return null;
        }
        return userAgent.length() > DEVICE_INFO_MAX ? userAgent.substring(0, DEVICE_INFO_MAX) : userAgent;
    }

    /**
     * Outcome of a successful refresh.
     */
    public record RefreshResult(User user, UUID sessionId, String accessToken, long expiresInSeconds) {
    }
}
