package com.example.authservice.service;

import com.example.authservice.entity.Permission;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.exception.PermissionDeniedException;
import org.springframework.stereotype.Service;

/**
 * Permission evaluation over the fixed role hierarchy.
 * Pure: reads roles and ids only, never touches the store.
 */
@Service
public class AuthorizationService {

    public boolean hasPermission(Role role, Permission permission) {
        return role != null && role.getPermissions().contains(permission);
    }

    public boolean hasPermission(User user, Permission permission) {
        return hasPermission(user.getRole(), permission);
    }

    /**
     * Superadmin manages everyone except other superadmins; admin tiers manage plain users;
     * everyone manages themselves.
     */
    public boolean canManage(User actor, User target) {
        boolean self = isSelf(actor, target);
        Role role = actor.getRole();
        if (role.isSuperadmin()) {
            return !target.getRole().isSuperadmin() || self;
        }
        if (role.isAdminTier()) {
            return target.getRole() == Role.USER;
        }
        return self;
    }

    /**
     * Superadmin views anyone; admin tiers view plain users and themselves;
     * users view themselves.
     */
    public boolean canView(User actor, User target) {
        boolean self = isSelf(actor, target);
        Role role = actor.getRole();
        if (role.isSuperadmin()) {
            return true;
        }
        if (role.isAdminTier()) {
            return target.getRole() == Role.USER || self;
        }
        return self;
    }

    /**
     * Administrative roles (superadmin, admin tiers) can only be granted by a superadmin;
     * the plain user role by any administrative role.
     */
    public boolean canAssignRole(Role actorRole, Role targetRole) {
        if (actorRole == null || targetRole == null) {
            return false;
        }
        if (targetRole.isAdministrative()) {
            return actorRole.isSuperadmin();
        }
        return actorRole.isAdministrative();
    }

    public boolean canAssignRole(User actor, Role targetRole) {
        return canAssignRole(actor.getRole(), targetRole);
    }

    // ==================== Enforcing variants ====================

    public void requirePermission(User actor, Permission permission) {
        if (!hasPermission(actor, permission)) {
            throw PermissionDeniedException.missing(permission);
        }
    }

    public void requireCanManage(User actor, User target) {
        if (!canManage(actor, target)) {
            throw new PermissionDeniedException(
                String.format("Role '%s' cannot manage users with role '%s'",
                    actor.getRole().getValue(), target.getRole().getValue()));
        }
    }

    public void requireCanView(User actor, User target) {
        if (!canView(actor, target)) {
            throw new PermissionDeniedException(
                String.format("Role '%s' cannot view users with role '%s'",
                    actor.getRole().getValue(), target.getRole().getValue()));
        }
    }

    public void requireCanAssignRole(User actor, Role targetRole) {
        if (!canAssignRole(actor, targetRole)) {
            String required = targetRole.isAdministrative() ? "superadmin" : "an administrative role";
            throw new PermissionDeniedException(
                String.format("Assigning role '%s' requires %s", targetRole.getValue(), required));
        }
    }

    private static boolean isSelf(User actor, User target) {
        return actor.getId() != null && actor.getId().equals(target.getId());
    }
}
