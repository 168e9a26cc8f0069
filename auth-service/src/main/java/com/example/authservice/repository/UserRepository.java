package com.example.authservice.repository;

import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for User entity.
 *
 * Emails are stored lower-cased; callers normalize input before lookup.
 * Lockout bookkeeping goes through single-statement updates so concurrent
 * failed logins never lose an increment.
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Find user by (normalized) email.
     * Used by login and password reset.
     */
    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    // ==================== Lockout bookkeeping ====================

    /**
     * Atomically increment the failed-login counter.
     *
     * @return number of updated rows (0 if the user vanished)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.failedLoginAttempts = u.failedLoginAttempts + 1, u.updatedAt = :now " +
            "WHERE u.id = :id")
    int incrementFailedLoginAttempts(@Param("id") UUID id, @Param("now") LocalDateTime now);

    /**
     * Lock the account until {@code until} once the counter reached the threshold.
     * Accounts that are already locked (and whose lock has not expired) are left alone,
     * so a permanent admin lock is never downgraded to a temporary one.
     *
     * @return 1 if this call locked the account, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.locked = true, u.lockedUntil = :until, u.updatedAt = :now " +
            "WHERE u.id = :id AND u.failedLoginAttempts >= :threshold " +
            "AND (u.locked = false OR (u.lockedUntil IS NOT NULL AND u.lockedUntil <= :now))")
    int lockAfterFailedAttempts(@Param("id") UUID id,
                                @Param("threshold") int threshold,
                                @Param("until") LocalDateTime until,
                                @Param("now") LocalDateTime now);

    /**
     * Reset the counter, clear an expired temporary lock and stamp last_login.
     * Refuses (returns 0) when the account holds a lock that is still in force.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.failedLoginAttempts = 0, u.locked = false, u.lockedUntil = NULL, " +
            "u.lastLogin = :now, u.updatedAt = :now " +
            "WHERE u.id = :id " +
            "AND (u.locked = false OR (u.lockedUntil IS NOT NULL AND u.lockedUntil <= :now))")
    int recordSuccessfulLogin(@Param("id") UUID id, @Param("now") LocalDateTime now);

    // ==================== Administration ====================

    /**
     * Filtered user search.
     * {@code pattern} is a lower-cased LIKE pattern; pass "%" to match everything.
     */
    @Query("SELECT u FROM User u WHERE " +
            "(LOWER(u.email) LIKE :pattern OR LOWER(u.firstName) LIKE :pattern " +
            "OR LOWER(u.lastName) LIKE :pattern " +
            "OR LOWER(CONCAT(u.firstName, ' ', u.lastName)) LIKE :pattern) AND " +
            "(:role IS NULL OR u.role = :role) AND " +
            "(:active IS NULL OR u.active = :active) AND " +
            "(:verified IS NULL OR u.verified = :verified) AND " +
            "(:locked IS NULL OR u.locked = :locked)")
    Page<User> search(@Param("pattern") String pattern,
                      @Param("role") Role role,
                      @Param("active") Boolean active,
                      @Param("verified") Boolean verified,
                      @Param("locked") Boolean locked,
                      Pageable pageable);

    // ==================== Statistics ====================

    long countByActiveTrue();

    long countByVerifiedTrue();

    long countByLockedTrue();

    long countByCreatedAtGreaterThanEqual(LocalDateTime since);

    long countByLastLoginGreaterThanEqual(LocalDateTime since);

    @Query("SELECT u.role, COUNT(u) FROM User u GROUP BY u.role")
    List<Object[]> countGroupedByRole();
}
