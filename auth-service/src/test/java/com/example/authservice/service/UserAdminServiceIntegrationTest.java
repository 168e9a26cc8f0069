package com.example.authservice.service;

import com.example.authservice.dto.CreateUserRequest;
import com.example.authservice.dto.LoginResponse;
import com.example.authservice.dto.RequestMeta;
import com.example.authservice.dto.UpdateUserRequest;
import com.example.authservice.dto.UserSearchCriteria;
import com.example.authservice.dto.UserStatsResponse;
import com.example.authservice.entity.AccountState;
import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AccountLockedException;
import com.example.authservice.exception.ConflictException;
import com.example.authservice.exception.InvalidTokenException;
import com.example.authservice.exception.PermissionDeniedException;
import com.example.authservice.exception.SelfActionException;
import com.example.authservice.exception.WeakPasswordException;
import com.example.authservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserAdminServiceIntegrationTest extends IntegrationTestSupport {

    private static final RequestMeta META = RequestMeta.none();

    @Autowired
    private UserAdminService userAdminService;

    @Autowired
    private AuthService authService;

    private User superadmin;
    private User admin;

    @BeforeEach
    void setUpActors() {
        superadmin = createUser("root@x.com", Role.SUPERADMIN);
        admin = createUser("admin@x.com", Role.ADMIN1);
    }

    private CreateUserRequest newUser(String email, Role role) {
        return new CreateUserRequest(email, PASSWORD, "New", "Person", role, null);
    }

    @Test
    void superadminCreatesAdminAndAdminCreatesUser() {
        User created = userAdminService.createUser(superadmin, newUser("Admin2@X.com", Role.ADMIN2), META);
        User user = userAdminService.createUser(admin, newUser("user@x.com", Role.USER), META);

        assertThat(created.getEmail()).isEqualTo("admin2@x.com");
        assertThat(created.getRole()).isEqualTo(Role.ADMIN2);
        assertThat(created.isActive()).isTrue();
        assertThat(user.getRole()).isEqualTo(Role.USER);

        awaitAuditWrites();
        List<AuditLog> audits = auditLogRepository.findByActionOrderByIdAsc(AuditAction.USER_CREATED);
        assertThat(audits).hasSize(2);
        assertThat(audits.get(0).getActorId()).isEqualTo(superadmin.getId());
        assertThat(audits.get(0).getNewValues()).contains("admin2@x.com").doesNotContain("passwordHash");
    }

    @Test
    void adminTierCannotCreateAnotherAdmin() {
        assertThatThrownBy(() -> userAdminService.createUser(admin, newUser("a2@x.com", Role.ADMIN2), META))
                .isInstanceOf(PermissionDeniedException.class);
        assertThat(userRepository.existsByEmail("a2@x.com")).isFalse();
    }

    @Test
    void plainUserCannotCreateAccounts() {
        User plain = createUser("plain@x.com", Role.USER);

        assertThatThrownBy(() -> userAdminService.createUser(plain, newUser("u2@x.com", Role.USER), META))
                .isInstanceOf(PermissionDeniedException.class);
    }

    @Test
    void duplicateEmailAndWeakPasswordAreRejected() {
        assertThatThrownBy(() -> userAdminService.createUser(superadmin, newUser("ADMIN@x.com", Role.USER), META))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> userAdminService.createUser(superadmin,
                new CreateUserRequest("weak@x.com", "weak", "W", "P", Role.USER, true), META))
                .isInstanceOf(WeakPasswordException.class);
    }

    @Test
    void selfActionsAreForbidden() {
        assertThatThrownBy(() -> userAdminService.deleteUser(admin, admin.getId(), META))
                .isInstanceOf(SelfActionException.class)
                .hasMessage("Cannot delete your own account");
        assertThatThrownBy(() -> userAdminService.lockUser(superadmin, superadmin.getId(), META))
                .isInstanceOf(SelfActionException.class);
        assertThatThrownBy(() -> userAdminService.updateUser(superadmin, superadmin.getId(),
                new UpdateUserRequest(null, null, Role.USER, null), META))
                .isInstanceOf(SelfActionException.class);
    }

    @Test
    void adminCannotManageAnotherAdmin() {
        User otherAdmin = createUser("admin3@x.com", Role.ADMIN3);

        assertThatThrownBy(() -> userAdminService.lockUser(admin, otherAdmin.getId(), META))
                .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> userAdminService.getUser(admin, otherAdmin.getId()))
                .isInstanceOf(PermissionDeniedException.class);
    }

    @Test
    void lockRevokesSessionsAndBlocksLoginUntilUnlocked() {
        User target = createUser("target@x.com", Role.USER);
        LoginResponse login = authService.login("target@x.com", PASSWORD, false, META);

        User locked = userAdminService.lockUser(admin, target.getId(), META);

        assertThat(AccountState.of(locked)).isEqualTo(AccountState.PERMANENTLY_LOCKED);
        assertThatThrownBy(() -> authService.refreshAccessToken(login.refreshToken(), META))
                .isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> authService.login("target@x.com", PASSWORD, false, META))
                .isInstanceOf(AccountLockedException.class)
                .satisfies(e -> assertThat(((AccountLockedException) e).isPermanent()).isTrue());

        User unlocked = userAdminService.unlockUser(admin, target.getId(), META);

        assertThat(AccountState.of(unlocked)).isEqualTo(AccountState.UNLOCKED);
        assertThat(authService.login("target@x.com", PASSWORD, false, META).accessToken()).isNotBlank();
        awaitAuditWrites();
        assertThat(auditLogRepository.findByResourceIdOrderByIdAsc(target.getId().toString()))
                .extracting(AuditLog::getAction)
                .contains(AuditAction.USER_LOCKED, AuditAction.USER_UNLOCKED);
    }

    @Test
    void deleteDeactivatesAndRevokesSessions() {
        User target = createUser("gone@x.com", Role.USER);
        LoginResponse login = authService.login("gone@x.com", PASSWORD, false, META);

        userAdminService.deleteUser(superadmin, target.getId(), META);

        assertThat(reload(target).isActive()).isFalse();
        assertThatThrownBy(() -> authService.refreshAccessToken(login.refreshToken(), META))
                .isInstanceOf(InvalidTokenException.class);
        awaitAuditWrites();
        assertThat(auditLogRepository.findByActionOrderByIdAsc(AuditAction.USER_DELETED)).hasSize(1);
    }

    @Test
    void updateChangesNamesAndRole() {
        User target = createUser("promote@x.com", Role.USER);

        User updated = userAdminService.updateUser(superadmin, target.getId(),
                new UpdateUserRequest("Grace", null, Role.ADMIN3, null), META);

        assertThat(updated.getFirstName()).isEqualTo("Grace");
        assertThat(updated.getRole()).isEqualTo(Role.ADMIN3);
        awaitAuditWrites();
        AuditLog audit = auditLogRepository.findByActionOrderByIdAsc(AuditAction.USER_UPDATED).get(0);
        assertThat(audit.getOldValues()).contains("\"firstName\":\"Test\"");
        assertThat(audit.getNewValues()).contains("\"firstName\":\"Grace\"");
    }

    @Test
    void adminSearchOnlySeesPlainUsers() {
        createUser("alice@x.com", Role.USER);
        createUser("bob@x.com", Role.USER);
        createUser("admin2@x.com", Role.ADMIN2);

        Page<User> forAdmin = userAdminService.searchUsers(admin, UserSearchCriteria.empty(), 1, 20, "email", "asc");
        Page<User> forSuperadmin = userAdminService.searchUsers(superadmin, UserSearchCriteria.empty(), 1, 20,
                "email", "asc");
        Page<User> byText = userAdminService.searchUsers(superadmin,
                new UserSearchCriteria("ALI", null, null, null, null), 1, 20, "created_at", "desc");

        assertThat(forAdmin.getContent()).extracting(User::getEmail).containsExactly("alice@x.com", "bob@x.com");
        assertThat(forSuperadmin.getTotalElements()).isEqualTo(5);
        assertThat(byText.getContent()).extracting(User::getEmail).containsExactly("alice@x.com");
    }

    @Test
    void statsCountDirectory() {
        createUser("u1@x.com", Role.USER);
        authService.login("u1@x.com", PASSWORD, false, META);

        UserStatsResponse stats = userAdminService.getStats(admin);

        assertThat(stats.totalUsers()).isEqualTo(3);
        assertThat(stats.activeUsers()).isEqualTo(3);
        assertThat(stats.lockedUsers()).isZero();
        assertThat(stats.usersByRole()).containsEntry("superadmin", 1L).containsEntry("admin1", 1L)
                .containsEntry("user", 1L).containsEntry("admin2", 0L);
        assertThat(stats.recentRegistrations()).isEqualTo(3);
        assertThat(stats.recentLogins()).isEqualTo(1);
    }

    @Test
    void userAuditLogsRequireVisibility() {
        User target = createUser("hist@x.com", Role.USER);
        authService.login("hist@x.com", PASSWORD, false, META);

        awaitAuditWrites();
        Page<AuditLog> logs = userAdminService.getUserAuditLogs(admin, target.getId(), 1, 10);

        assertThat(logs.getContent()).extracting(AuditLog::getAction).contains(AuditAction.LOGIN_SUCCESSFUL);
        assertThatThrownBy(() -> userAdminService.getUserAuditLogs(admin, superadmin.getId(), 1, 10))
                .isInstanceOf(PermissionDeniedException.class);
    }
}
