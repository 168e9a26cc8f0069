package com.example.authservice.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Fixed role tiers.
 *
 * Every constant declares its complete permission set, so the role to permission
 * mapping is total. Admin tiers are siblings: none of them manages another admin.
 * The lower-case value is what travels in the {@code role} claim of access tokens.
 */
public enum Role {

    SUPERADMIN("superadmin", EnumSet.of(
            Permission.MANAGE_ADMINS,
            Permission.MANAGE_USERS,
            Permission.VIEW_AUDIT_LOGS,
            Permission.MANAGE_SYSTEM_SETTINGS,
            Permission.VIEW_ANALYTICS,
            Permission.MANAGE_ROLES)),

    ADMIN1("admin1", EnumSet.of(
            Permission.MANAGE_USERS,
            Permission.VIEW_AUDIT_LOGS,
            Permission.VIEW_ANALYTICS)),

    ADMIN2("admin2", EnumSet.of(
            Permission.MANAGE_USERS,
            Permission.VIEW_AUDIT_LOGS,
            Permission.VIEW_ANALYTICS)),

    ADMIN3("admin3", EnumSet.of(
            Permission.MANAGE_USERS,
            Permission.VIEW_AUDIT_LOGS,
            Permission.VIEW_ANALYTICS)),

    USER("user", EnumSet.of(
            Permission.VIEW_PROFILE,
            Permission.UPDATE_PROFILE));

    private final String value;
    private final Set<Permission> permissions;

    Role(String value, Set<Permission> permissions) {
        this.value = value;
        this.permissions = Collections.unmodifiableSet(permissions);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    public boolean isSuperadmin() {
        return this == SUPERADMIN;
    }

    public boolean isAdminTier() {
        return this == ADMIN1 || this == ADMIN2 || this == ADMIN3;
    }

    /**
     * Superadmin or any admin tier.
     */
    public boolean isAdministrative() {
        return isSuperadmin() || isAdminTier();
    }

    /**
     * Parse a role from its wire value ("admin1") or constant name ("ADMIN1").
     *
     * @throws IllegalArgumentException if the value names no role
     */
    @JsonCreator
    public static Role fromValue(String value) {
        if (value != null) {
            for (Role role : values()) {
                if (role.value.equalsIgnoreCase(value.trim())) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
