package com.example.authservice.entity;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class UserTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 15, 10, 0);

    @Test
    void temporaryLockLapsesAtItsDeadline() {
        User user = new User();
        user.lock(NOW.plusMinutes(30));

        assertThat(AccountState.of(user)).isEqualTo(AccountState.TEMPORARILY_LOCKED);
        assertThat(user.isLockedAt(NOW)).isTrue();
        assertThat(user.isLockedAt(NOW.plusMinutes(29))).isTrue();
        assertThat(user.isLockedAt(NOW.plusMinutes(30))).isFalse();
    }

    @Test
    void lockWithoutDeadlineIsPermanent() {
        User user = new User();
        user.lock(null);

        assertThat(AccountState.of(user)).isEqualTo(AccountState.PERMANENTLY_LOCKED);
        assertThat(user.isLockedAt(NOW.plusYears(10))).isTrue();
    }

    @Test
    void unlockClearsLockAndCounter() {
        User user = new User();
        user.setFailedLoginAttempts(5);
        user.lock(NOW.plusMinutes(30));

        user.unlock();

        assertThat(AccountState.of(user)).isEqualTo(AccountState.UNLOCKED);
        assertThat(user.getLockedUntil()).isNull();
        assertThat(user.getFailedLoginAttempts()).isZero();
        assertThat(user.isLockedAt(NOW)).isFalse();
    }

    @Test
    void fullNameJoinsFirstAndLastName() {
        User user = new User();
        user.setFirstName("Ada");
        user.setLastName("Lovelace");

        assertThat(user.getFullName()).isEqualTo("Ada Lovelace");
    }
}
