package com.example.authservice.repository;

import com.example.authservice.entity.User;
import com.example.authservice.entity.UserSession;
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
 * Repository for UserSession entity.
 */
@Repository
public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    Optional<UserSession> findByRefreshToken(String refreshToken);

    Optional<UserSession> findByIdAndUser(UUID id, User user);

    /**
     * Active sessions that have not expired yet.
     */
    @Query("SELECT s FROM UserSession s WHERE s.user = :user AND s.active = true AND s.expiresAt > :now " +
            "ORDER BY s.lastUsedAt DESC")
    List<UserSession> findUsableByUser(@Param("user") User user, @Param("now") LocalDateTime now);

    long countByUserAndActiveTrue(User user);

    /**
     * Deactivate every active session of a user.
     * Used by logout-all, password change/reset, admin lock, deactivation.
     *
     * @return number of sessions deactivated
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserSession s SET s.active = false WHERE s.user = :user AND s.active = true")
    int revokeAllByUser(@Param("user") User user);

    /**
     * Deactivate sessions whose refresh token expired.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserSession s SET s.active = false WHERE s.active = true AND s.expiresAt < :now")
    int deactivateExpired(@Param("now") LocalDateTime now);
}
