package com.example.authservice.service;

import com.example.authservice.entity.Permission;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.exception.PermissionDeniedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthorizationServiceTest {

    private final AuthorizationService authorization = new AuthorizationService();

    private static User user(Role role) {
        User user = new User();
        user.setId(UUID.randomUUID());
        user.setEmail(role.getValue() + "@x.com");
        user.setRole(role);
        return user;
    }

    @Test
    void onlySuperadminAssignsAdministrativeRoles() {
        assertThat(authorization.canAssignRole(Role.ADMIN1, Role.ADMIN2)).isFalse();
        assertThat(authorization.canAssignRole(Role.SUPERADMIN, Role.ADMIN2)).isTrue();
        assertThat(authorization.canAssignRole(Role.SUPERADMIN, Role.SUPERADMIN)).isTrue();
        assertThat(authorization.canAssignRole(Role.ADMIN1, Role.USER)).isTrue();
        assertThat(authorization.canAssignRole(Role.USER, Role.USER)).isFalse();
    }

    @Test
    void superadminManagesEveryoneButOtherSuperadmins() {
        User superadmin = user(Role.SUPERADMIN);

        assertThat(authorization.canManage(superadmin, user(Role.ADMIN3))).isTrue();
        assertThat(authorization.canManage(superadmin, user(Role.USER))).isTrue();
        assertThat(authorization.canManage(superadmin, user(Role.SUPERADMIN))).isFalse();
        assertThat(authorization.canManage(superadmin, superadmin)).isTrue();
    }

    @Test
    void adminTiersManageOnlyPlainUsers() {
        User admin = user(Role.ADMIN2);

        assertThat(authorization.canManage(admin, user(Role.USER))).isTrue();
        assertThat(authorization.canManage(admin, user(Role.ADMIN1))).isFalse();
        assertThat(authorization.canManage(admin, user(Role.SUPERADMIN))).isFalse();
    }

    @Test
    void usersOnlyViewAndManageThemselves() {
        User self = user(Role.USER);

        assertThat(authorization.canView(self, self)).isTrue();
        assertThat(authorization.canManage(self, self)).isTrue();
        assertThat(authorization.canView(self, user(Role.USER))).isFalse();
        assertThat(authorization.canManage(self, user(Role.USER))).isFalse();
    }

    @Test
    void adminTiersViewPlainUsersAndThemselves() {
        User admin = user(Role.ADMIN1);

        assertThat(authorization.canView(admin, admin)).isTrue();
        assertThat(authorization.canView(admin, user(Role.USER))).isTrue();
        assertThat(authorization.canView(admin, user(Role.ADMIN3))).isFalse();
        assertThat(authorization.canView(user(Role.SUPERADMIN), user(Role.SUPERADMIN))).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = Role.class, names = {"ADMIN1", "ADMIN2", "ADMIN3"})
    void adminTiersShareTheSamePermissions(Role role) {
        assertThat(role.getPermissions()).containsExactlyInAnyOrder(
                Permission.MANAGE_USERS, Permission.VIEW_AUDIT_LOGS, Permission.VIEW_ANALYTICS);
    }

    @Test
    void requirePermissionNamesTheMissingPermission() {
        assertThatThrownBy(() -> authorization.requirePermission(user(Role.USER), Permission.VIEW_AUDIT_LOGS))
                .isInstanceOf(PermissionDeniedException.class)
                .hasMessageContaining("view_audit_logs");
        assertThatCode(() -> authorization.requirePermission(user(Role.ADMIN3), Permission.VIEW_AUDIT_LOGS))
                .doesNotThrowAnyException();
    }

    @Test
    void roleValuesParseCaseInsensitively() {
        assertThat(Role.fromValue("admin1")).isEqualTo(Role.ADMIN1);
        assertThat(Role.fromValue("SUPERADMIN")).isEqualTo(Role.SUPERADMIN);
        assertThatThrownBy(() -> Role.fromValue("root")).isInstanceOf(IllegalArgumentException.class);
    }
}
