package com.example.authservice.repository;

import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Single-statement lockout updates against a real schema.
 */
@DataJpaTest
@ActiveProfiles("test")
class UserRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 15, 10, 0);

    @Autowired
    private UserRepository userRepository;

    private UUID userId;

    @BeforeEach
    void setUp() {
        User user = new User();
        user.setEmail("repo@x.com");
        user.setPasswordHash("$2a$04$hash");
        user.setFirstName("Repo");
        user.setLastName("User");
        user.setRole(Role.USER);
        user.setCreatedAt(NOW);
        user.setUpdatedAt(NOW);
        user.setPasswordChangedAt(NOW);
        userId = userRepository.saveAndFlush(user).getId();
    }

    private User load() {
        return userRepository.findById(userId).orElseThrow();
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            userRepository.incrementFailedLoginAttempts(userId, NOW);
        }
    }

    @Test
    void lockAppliesOnlyOnceThresholdIsReached() {
        fail(4);
        assertThat(userRepository.lockAfterFailedAttempts(userId, 5, NOW.plusMinutes(30), NOW)).isZero();

        fail(1);
        assertThat(userRepository.lockAfterFailedAttempts(userId, 5, NOW.plusMinutes(30), NOW)).isEqualTo(1);

        User locked = load();
        assertThat(locked.getFailedLoginAttempts()).isEqualTo(5);
        assertThat(locked.isLocked()).isTrue();
        assertThat(locked.getLockedUntil()).isEqualTo(NOW.plusMinutes(30));
    }

    @Test
    void permanentLockIsNeverDowngraded() {
        User user = load();
        user.lock(null);
        userRepository.saveAndFlush(user);

        fail(5);

        assertThat(userRepository.lockAfterFailedAttempts(userId, 5, NOW.plusMinutes(30), NOW)).isZero();
        assertThat(load().getLockedUntil()).isNull();
    }

    @Test
    void successfulLoginIsRefusedWhileLockIsInForce() {
        fail(5);
        userRepository.lockAfterFailedAttempts(userId, 5, NOW.plusMinutes(30), NOW);

        assertThat(userRepository.recordSuccessfulLogin(userId, NOW.plusMinutes(10))).isZero();
        assertThat(userRepository.recordSuccessfulLogin(userId, NOW.plusMinutes(30))).isEqualTo(1);

        User user = load();
        assertThat(user.isLocked()).isFalse();
        assertThat(user.getLockedUntil()).isNull();
        assertThat(user.getFailedLoginAttempts()).isZero();
        assertThat(user.getLastLogin()).isEqualTo(NOW.plusMinutes(30));
    }

    @Test
    void statisticsGroupByRole() {
        assertThat(userRepository.countGroupedByRole())
                .singleElement()
                .satisfies(row -> {
                    assertThat(row[0]).isEqualTo(Role.USER);
                    assertThat(((Number) row[1]).longValue()).isEqualTo(1L);
                });
        assertThat(userRepository.countByActiveTrue()).isEqualTo(1);
        assertThat(userRepository.countByLockedTrue()).isZero();
    }
}
