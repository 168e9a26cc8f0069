package com.example.authservice.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Audit action types for AuditLog.
 * Stored by enum name; exposed over the API in lower snake case ("login_successful").
 */
public enum AuditAction {
    // Authentication
    LOGIN_SUCCESSFUL,
    LOGIN_FAILED,
    LOGIN_DENIED,            // inactive or locked account
    LOGOUT,
    LOGOUT_ALL_DEVICES,
    TOKEN_REFRESHED,
    ACCOUNT_LOCKED_FAILED_ATTEMPTS,

    // User lifecycle (administration)
    USER_CREATED,
    USER_UPDATED,
    USER_DELETED,            // soft delete
    USER_LOCKED,
    USER_UNLOCKED,

    // Self-service
    PROFILE_UPDATED,
    PASSWORD_CHANGED,
    PASSWORD_RESET_REQUESTED,
    PASSWORD_RESET_COMPLETED,
    SESSION_REVOKED,
    EMAIL_VERIFIED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts either the API value or the enum name, case-insensitively.
     */
    public static AuditAction fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Audit action must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (AuditAction action : values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + value);
    }
}
