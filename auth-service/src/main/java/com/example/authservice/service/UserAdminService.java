package com.example.authservice.service;

import com.example.authservice.dto.CreateUserRequest;
import com.example.authservice.dto.RequestMeta;
import com.example.authservice.dto.UpdateUserRequest;
import com.example.authservice.dto.UserAuditDto;
import com.example.authservice.dto.UserSearchCriteria;
import com.example.authservice.dto.UserStatsResponse;
import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.entity.Permission;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.exception.ConflictException;
import com.example.authservice.exception.ResourceNotFoundException;
import com.example.authservice.exception.SelfActionException;
import com.example.authservice.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Admin service for user management.
 * Every operation is authorized through {@link AuthorizationService} against the acting user.
 * Deletion is soft: the account is deactivated and its sessions revoked.
 */
@Service
public class UserAdminService {

    private static final Logger log = LoggerFactory.getLogger(UserAdminService.class);

    private static final Map<String, String> SORT_FIELDS = Map.of(
            "email", "email",
            "first_name", "firstName",
            "last_name", "lastName",
            "role", "role",
            "last_login", "lastLogin",
            "created_at", "createdAt");

    private static final int RECENT_DAYS = 30;

    private final UserRepository userRepository;
    private final AuthorizationService authorizationService;
    private final PasswordPolicyService passwordPolicy;
    private final PasswordEncoder passwordEncoder;
    private final AccountLockoutService lockoutService;
    private final SessionService sessionService;
    private final AuthService authService;
    private final AuditService auditService;
    private final Clock clock;

    public UserAdminService(
            UserRepository userRepository,
            AuthorizationService authorizationService,
            PasswordPolicyService passwordPolicy,
            PasswordEncoder passwordEncoder,
            AccountLockoutService lockoutService,
            SessionService sessionService,
            AuthService authService,
            AuditService auditService,
            Clock clock) {
        this.userRepository = userRepository;
        this.authorizationService = authorizationService;
        this.passwordPolicy = passwordPolicy;
        this.passwordEncoder = passwordEncoder;
        this.lockoutService = lockoutService;
        this.sessionService = sessionService;
        this.authService = authService;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * Create an account with the requested role.
     *
     * @throws ConflictException if the email is already registered (409)
     */
    @Transactional
    public User createUser(User actor, CreateUserRequest request, RequestMeta meta) {
        authorizationService.requirePermission(actor, Permission.MANAGE_USERS);
        authorizationService.requireCanAssignRole(actor, request.role());
        passwordPolicy.requireStrongPassword(request.password());

        String email = AuthService.normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw ConflictException.emailAlreadyExists(email);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        User user = new User();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFirstName(request.firstName().trim());
        user.setLastName(request.lastName().trim());
        user.setRole(request.role());
        user.setActive(request.activeOrDefault());
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        user.setPasswordChangedAt(now);

        // DB UNIQUE constraint handles the race between the check and the insert
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw ConflictException.emailAlreadyExists(email);
        }

        auditService.record(AuditAction.USER_CREATED, AuditService.RESOURCE_USER, user.getId().toString(),
                actor, null, UserAuditDto.from(user), meta);
        log.info("User {} created with role {} by {}", user.getId(), user.getRole().getValue(), actor.getId());

        authService.sendEmailVerification(user);
        return user;
    }

    @Transactional(readOnly = true)
    public User getUser(User actor, UUID userId) {
        User target = load(userId);
        authorizationService.requireCanView(actor, target);
        return target;
    }

    /**
     * Partial update. A role change also needs the right to assign the new role;
     * deactivation revokes every session of the target.
     */
    @Transactional
    public User updateUser(User actor, UUID userId, UpdateUserRequest request, RequestMeta meta) {
        User target = load(userId);
        authorizationService.requireCanManage(actor, target);
        boolean self = target.getId().equals(actor.getId());

        if (request.role() != null && request.role() != target.getRole()) {
            if (self) {
                throw new SelfActionException("change the role of");
            }
            authorizationService.requireCanAssignRole(actor, request.role());
        }
        if (Boolean.FALSE.equals(request.active()) && self) {
            throw new SelfActionException("deactivate");
        }

        UserAuditDto before = UserAuditDto.from(target);
        boolean deactivating = target.isActive() && Boolean.FALSE.equals(request.active());

        if (request.firstName() != null) {
            target.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            target.setLastName(request.lastName().trim());
        }
        if (request.role() != null) {
            target.setRole(request.role());
        }
        if (request.active() != null) {
            target.setActive(request.active());
        }
        target.setUpdatedAt(LocalDateTime.now(clock));
        target = userRepository.save(target);
        UserAuditDto after = UserAuditDto.from(target);

        if (deactivating) {
            sessionService.revokeAll(target);
        }

        auditService.record(AuditAction.USER_UPDATED, AuditService.RESOURCE_USER, userId.toString(),
                actor, before, after, meta);
        return target;
    }

    /**
     * Soft delete: deactivate and revoke all sessions. The row and its audit history remain.
     */
    @Transactional
    public void deleteUser(User actor, UUID userId, RequestMeta meta) {
        if (userId.equals(actor.getId())) {
            throw new SelfActionException("delete");
        }
        User target = load(userId);
        authorizationService.requireCanManage(actor, target);

        UserAuditDto before = UserAuditDto.from(target);
        target.deactivate();
        target.setUpdatedAt(LocalDateTime.now(clock));
        userRepository.save(target);
        int revoked = sessionService.revokeAll(target);

        auditService.record(AuditAction.USER_DELETED, AuditService.RESOURCE_USER, userId.toString(),
                actor, before, Map.of("active", false, "sessionsRevoked", revoked), meta);
        log.info("User {} deactivated by {}", userId, actor.getId());
    }

    @Transactional
    public User lockUser(User actor, UUID userId, RequestMeta meta) {
        if (userId.equals(actor.getId())) {
            throw new SelfActionException("lock");
        }
        User target = load(userId);
        authorizationService.requireCanManage(actor, target);

        Map<String, Object> before = lockSnapshot(target);
        lockoutService.lock(target);
        User locked = load(userId);

        auditService.record(AuditAction.USER_LOCKED, AuditService.RESOURCE_USER, userId.toString(),
                actor, before, lockSnapshot(locked), meta);
        return locked;
    }

    @Transactional
    public User unlockUser(User actor, UUID userId, RequestMeta meta) {
        User target = load(userId);
        authorizationService.requireCanManage(actor, target);

        Map<String, Object> before = lockSnapshot(target);
        lockoutService.unlock(target);
        User unlocked = load(userId);

        auditService.record(AuditAction.USER_UNLOCKED, AuditService.RESOURCE_USER, userId.toString(),
                actor, before, lockSnapshot(unlocked), meta);
        return unlocked;
    }

    /**
     * Paginated directory search. Actors other than superadmin only see plain users.
     *
     * @param page    1-based page number
     * @param sortBy  one of email, first_name, last_name, role, last_login, created_at
     * @param sortDir asc or desc
     */
    @Transactional(readOnly = true)
    public Page<User> searchUsers(User actor, UserSearchCriteria criteria, int page, int size,
                                  String sortBy, String sortDir) {
        authorizationService.requirePermission(actor, Permission.MANAGE_USERS);

        UserSearchCriteria effective = criteria != null ? criteria : UserSearchCriteria.empty();
        if (!actor.getRole().isSuperadmin()) {
            effective = effective.withRole(Role.USER);
        }

        String property = SORT_FIELDS.getOrDefault(sortBy == null ? "" : sortBy.toLowerCase(Locale.ROOT), "createdAt");
        Sort.Direction direction = "asc".equalsIgnoreCase(sortDir) ? Sort.Direction.ASC : Sort.Direction.DESC;
        PageRequest pageable = PageRequest.of(Math.max(page, 1) - 1, size, Sort.by(direction, property));

        return userRepository.search(likePattern(effective.search()), effective.role(),
                effective.active(), effective.verified(), effective.locked(), pageable);
    }

    @Transactional(readOnly = true)
    public UserStatsResponse getStats(User actor) {
        authorizationService.requirePermission(actor, Permission.VIEW_ANALYTICS);

        Map<String, Long> byRole = new LinkedHashMap<>();
        for (Role role : Role.values()) {
            byRole.put(role.getValue(), 0L);
        }
        for (Object[] row : userRepository.countGroupedByRole()) {
            byRole.put(((Role) row[0]).getValue(), ((Number) row[1]).longValue());
        }

        LocalDateTime since = LocalDateTime.now(clock).minusDays(RECENT_DAYS);
        return new UserStatsResponse(
                userRepository.count(),
                userRepository.countByActiveTrue(),
                userRepository.countByVerifiedTrue(),
                userRepository.countByLockedTrue(),
                byRole,
                userRepository.countByCreatedAtGreaterThanEqual(since),
                userRepository.countByLastLoginGreaterThanEqual(since));
    }

    /**
     * Audit entries performed by a given user.
     */
    @Transactional(readOnly = true)
    public Page<AuditLog> getUserAuditLogs(User actor, UUID userId, int page, int size) {
        authorizationService.requirePermission(actor, Permission.VIEW_AUDIT_LOGS);
        User target = load(userId);
        authorizationService.requireCanView(actor, target);
        return auditService.search(userId, null, null, page, size);
    }

    private User load(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.userNotFound(userId));
    }

    private static String likePattern(String search) {
        if (search == null || search.isBlank()) {
            return "%";
        }
        return "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
    }

    private static Map<String, Object> lockSnapshot(User user) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("locked", user.isLocked());
        snapshot.put("lockedUntil", user.getLockedUntil() != null ? user.getLockedUntil().toString() : null);
        snapshot.put("failedLoginAttempts", user.getFailedLoginAttempts());
        return snapshot;
    }
}
