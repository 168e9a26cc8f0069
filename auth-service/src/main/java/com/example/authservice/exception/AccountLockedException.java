package com.example.authservice.exception;

import com.example.authservice.entity.User;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Account refuses authentication because of a lock (HTTP 403).
 * Temporary locks carry the number of seconds until the lock lapses.
 */
public class AccountLockedException extends BaseException {

    private final Long retryAfterSeconds;

    private AccountLockedException(String message, Long retryAfterSeconds) {
        super("ACCOUNT_LOCKED", message, HttpStatus.FORBIDDEN);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static AccountLockedException temporary(long retryAfterSeconds) {
        return new AccountLockedException(
                String.format("Account is temporarily locked. Try again in %d seconds", retryAfterSeconds),
                retryAfterSeconds);
    }

    public static AccountLockedException permanent() {
        return new AccountLockedException("Account is locked. Contact an administrator", null);
    }

    /**
     * Build the exception matching the user's current lock.
     */
    public static AccountLockedException forUser(User user, LocalDateTime now) {
        if (user.getLockedUntil() == null) {
            return permanent();
        }
        long seconds = Math.max(1, Duration.between(now, user.getLockedUntil()).toSeconds());
        return temporary(seconds);
    }

    public boolean isPermanent() {
        return retryAfterSeconds == null;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    @Override
    public Map<String, Object> getDetails() {
        return retryAfterSeconds == null
                ? Map.of("permanent", true)
                : Map.of("retryAfterSeconds", retryAfterSeconds);
    }
}
