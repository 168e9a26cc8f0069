package com.example.authservice.repository;

import com.example.authservice.entity.PasswordResetRequest;
import com.example.authservice.entity.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for PasswordResetRequest entity.
 */
@Repository
public interface PasswordResetRequestRepository extends JpaRepository<PasswordResetRequest, UUID> {

    /**
     * Load a reset request for redemption.
     * Row lock keeps two concurrent confirmations from both succeeding.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PasswordResetRequest p WHERE p.token = :token")
    Optional<PasswordResetRequest> findByTokenForUpdate(@Param("token") String token);

    /**
     * Mark every still-unused reset request of a user as used.
     * Called once a reset is redeemed, so older links stop working.
     *
     * @return number of requests invalidated
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PasswordResetRequest p SET p.used = true, p.usedAt = :now " +
            "WHERE p.user = :user AND p.used = false")
    int invalidateOutstanding(@Param("user") User user, @Param("now") LocalDateTime now);
}
