package com.example.authservice.entity;

/**
 * Lockout state of an account.
 *
 * {@code is_locked} is the discriminator: a null {@code locked_until} only means
 * "permanent" when the lock flag is set.
 */
public enum AccountState {
    UNLOCKED,
    TEMPORARILY_LOCKED,
    PERMANENTLY_LOCKED;

    public static AccountState of(User user) {
        if (!user.isLocked()) {
            return UNLOCKED;
        }
        return user.getLockedUntil() == null ? PERMANENTLY_LOCKED : TEMPORARILY_LOCKED;
    }
}
