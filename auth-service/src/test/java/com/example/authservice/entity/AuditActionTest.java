package com.example.authservice.entity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditActionTest {

    @Test
    void valuesAreLowerCaseNames() {
        assertThat(AuditAction.LOGIN_FAILED.getValue()).isEqualTo("login_failed");
        assertThat(AuditAction.ACCOUNT_LOCKED_FAILED_ATTEMPTS.getValue()).isEqualTo("account_locked_failed_attempts");
    }

    @Test
    void fromValueIgnoresCase() {
        assertThat(AuditAction.fromValue("password_changed")).isEqualTo(AuditAction.PASSWORD_CHANGED);
        assertThat(AuditAction.fromValue("USER_LOCKED")).isEqualTo(AuditAction.USER_LOCKED);
        assertThatThrownBy(() -> AuditAction.fromValue("nope")).isInstanceOf(IllegalArgumentException.class);
    }
}
