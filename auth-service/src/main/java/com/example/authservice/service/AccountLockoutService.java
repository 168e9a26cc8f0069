package com.example.authservice.service;

import com.example.authservice.dto.RequestMeta;
import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AccountInactiveException;
import com.example.authservice.exception.AccountLockedException;
import com.example.authservice.exception.ResourceNotFoundException;
import com.example.authservice.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Account lockout state machine.
 *
 * UNLOCKED --(max-attempts failures)--> TEMPORARILY_LOCKED --(duration elapses + success)--> UNLOCKED
 * any state --(admin lock)--> PERMANENTLY_LOCKED --(admin unlock)--> UNLOCKED
 *
 * Counter and lock transitions are single-statement updates, so concurrent failures
 * never lose an increment and the counter never goes backward.
 */
@Service
public class AccountLockoutService {

    private static final Logger log = LoggerFactory.getLogger(AccountLockoutService.class);

    private final UserRepository userRepository;
    private final SessionService sessionService;
    private final AuditService auditService;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration lockoutDuration;

    public AccountLockoutService(
            UserRepository userRepository,
            SessionService sessionService,
            AuditService auditService,
            Clock clock,
            @Value("${app.security.lockout.max-attempts:5}") int maxAttempts,
            @Value("${app.security.lockout.duration:30m}") Duration lockoutDuration) {
        this.userRepository = userRepository;
        this.sessionService = sessionService;
        this.auditService = auditService;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.lockoutDuration = lockoutDuration;
    }

    /**
     * Refuse authentication for inactive or currently locked accounts. Does not mutate.
     */
    public void checkCanAuthenticate(User user) {
        if (!user.isActive()) {
            throw new AccountInactiveException();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (user.isLockedAt(now)) {
            throw AccountLockedException.forUser(user, now);
        }
    }

    /**
     * Count a failed password attempt; lock the account once the threshold is reached.
     *
     * @return true when this attempt locked the account
     */
    @Transactional
    public boolean recordFailedAttempt(User user, RequestMeta meta) {
        LocalDateTime now = LocalDateTime.now(clock);
        userRepository.incrementFailedLoginAttempts(user.getId(), now);

        LocalDateTime until = now.plus(lockoutDuration);
        boolean locked = userRepository.lockAfterFailedAttempts(user.getId(), maxAttempts, until, now) > 0;
        if (locked) {
            log.warn("Account {} locked until {} after {} failed login attempts", user.getId(), until, maxAttempts);
            auditService.record(AuditAction.ACCOUNT_LOCKED_FAILED_ATTEMPTS, AuditService.RESOURCE_USER,
                    user.getId().toString(), null, null,
                    Map.of("lockedUntil", until.toString(), "failedAttempts", maxAttempts), meta);
        }
        return locked;
    }

    /**
     * Reset the counter, clear an expired temporary lock and stamp last_login.
     *
     * @return the refreshed user
     * @throws AccountLockedException when a lock appeared concurrently
     */
    @Transactional(noRollbackFor = AccountLockedException.class)
    public User recordSuccessfulAuthentication(User user) {
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = userRepository.recordSuccessfulLogin(user.getId(), now);

        User current = userRepository.findById(user.getId())
                .orElseThrow(() -> ResourceNotFoundException.userNotFound(user.getId()));
        if (updated == 0) {
            throw AccountLockedException.forUser(current, now);
        }
        return current;
    }

    /**
     * Administrative lock: permanent until manually unlocked. Revokes all sessions.
     */
    @Transactional
    public void lock(User user) {
        user.lock(null);
        user.setUpdatedAt(LocalDateTime.now(clock));
        userRepository.save(user);
        sessionService.revokeAll(user);
        log.warn("Account {} locked by administrator", user.getId());
    }

    @Transactional
    public void unlock(User user) {
        user.unlock();
        user.setUpdatedAt(LocalDateTime.now(clock));
        userRepository.save(user);
        log.info("Account {} unlocked", user.getId());
    }
}
