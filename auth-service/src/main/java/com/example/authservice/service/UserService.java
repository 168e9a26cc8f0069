package com.example.authservice.service;

import com.example.authservice.dto.RequestMeta;
import com.example.authservice.dto.UpdateProfileRequest;
import com.example.authservice.dto.UserAuditDto;
import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.User;
import com.example.authservice.exception.InvalidCurrentPasswordException;
import com.example.authservice.exception.ResourceNotFoundException;
import com.example.authservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Self-service operations on the caller's own account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final PasswordPolicyService passwordPolicy;
    private final SessionService sessionService;
    private final AuditService auditService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public User getProfile(User user) {
        return load(user.getId());
    }

    @Transactional
    public User updateProfile(User user, UpdateProfileRequest request, RequestMeta meta) {
        User current = load(user.getId());
        UserAuditDto before = UserAuditDto.from(current);

        if (request.firstName() != null) {
            current.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            current.setLastName(request.lastName().trim());
        }
        if (request.avatarUrl() != null) {
            current.setAvatarUrl(request.avatarUrl().isBlank() ? null : request.avatarUrl().trim());
        }
        current.setUpdatedAt(LocalDateTime.now(clock));
        current = userRepository.save(current);

        auditService.record(AuditAction.PROFILE_UPDATED, AuditService.RESOURCE_USER,
                current.getId().toString(), current, before, UserAuditDto.from(current), meta);
        return current;
    }

    /**
     * Change the caller's password and sign out every session.
     *
     * @throws InvalidCurrentPasswordException current password does not match
     */
    @Transactional
    public void changePassword(User user, String currentPassword, String newPassword, RequestMeta meta) {
        User current = load(user.getId());

        if (!passwordEncoder.matches(currentPassword, current.getPasswordHash())) {
            throw new InvalidCurrentPasswordException();
        }
        passwordPolicy.requireStrongPassword(newPassword);

        LocalDateTime now = LocalDateTime.now(clock);
        current.setPasswordHash(passwordEncoder.encode(newPassword));
        current.setPasswordChangedAt(now);
        current.setUpdatedAt(now);
        userRepository.save(current);

        int revoked = sessionService.revokeAll(current);
        auditService.record(AuditAction.PASSWORD_CHANGED, AuditService.RESOURCE_USER,
                current.getId().toString(), current, null, Map.of("sessionsRevoked", revoked), meta);
        log.info("Password changed for user {}", current.getId());
    }

    private User load(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.userNotFound(userId));
    }
}
