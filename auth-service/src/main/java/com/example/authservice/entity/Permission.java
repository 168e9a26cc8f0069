package com.example.authservice.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fine-grained permissions granted through {@link Role}.
 */
public enum Permission {
    MANAGE_ADMINS("manage_admins"),
    MANAGE_USERS("manage_users"),
    VIEW_AUDIT_LOGS("view_audit_logs"),
    MANAGE_SYSTEM_SETTINGS("manage_system_settings"),
    VIEW_ANALYTICS("view_analytics"),
    MANAGE_ROLES("manage_roles"),
    VIEW_PROFILE("view_profile"),
    UPDATE_PROFILE("update_profile");

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
