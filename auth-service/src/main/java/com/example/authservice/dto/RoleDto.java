package com.example.authservice.dto;

import com.example.authservice.entity.Permission;
import com.example.authservice.entity.Role;

import java.util.Set;

/**
 * Role catalogue entry.
 */
public record RoleDto(
    Role role,
    Set<Permission> permissions
) {
    public static RoleDto of(Role role) {
        return new RoleDto(role, role.getPermissions());
    }
}
