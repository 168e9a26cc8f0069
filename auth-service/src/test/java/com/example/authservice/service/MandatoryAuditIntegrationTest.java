package com.example.authservice.service;

import com.example.authservice.dto.RequestMeta;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AuditWriteException;
import com.example.authservice.repository.AuditLogRepository;
import com.example.authservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * With app.audit.mandatory=true an operation whose audit entry cannot be written fails
 * and leaves no trace.
 */
@TestPropertySource(properties = "app.audit.mandatory=true")
class MandatoryAuditIntegrationTest extends IntegrationTestSupport {

    private static final RequestMeta META = new RequestMeta("192.0.2.30", "JUnit");

    @MockBean
    private AuditLogRepository auditStore;

    @Autowired
    private AuthService authService;

    @Autowired
    private UserService userService;

    @BeforeEach
    void breakAuditStore() {
        when(auditStore.saveAndFlush(any(AuditLog.class)))
                .thenThrow(new DataAccessResourceFailureException("audit store unavailable"));
    }

    @Test
    void loginFailsAndRollsBackWhenAuditWriteFails() {
        User user = createUser("strict@x.com", Role.USER);

        assertThatThrownBy(() -> authService.login("strict@x.com", PASSWORD, false, META))
                .isInstanceOf(AuditWriteException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class)
                .satisfies(e -> assertThat(((AuditWriteException) e).getCode()).isEqualTo("AUDIT_WRITE_FAILED"));

        assertThat(sessionRepository.count()).isZero();
        assertThat(reload(user).getLastLogin()).isNull();
    }

    @Test
    void passwordChangeIsRolledBackWhenAuditWriteFails() {
        User user = createUser("strict2@x.com", Role.USER);

        assertThatThrownBy(() -> userService.changePassword(user, PASSWORD, "N3w!Passw0rd", META))
                .isInstanceOf(AuditWriteException.class);

        User unchanged = reload(user);
        assertThat(passwordEncoder.matches(PASSWORD, unchanged.getPasswordHash())).isTrue();
        assertThat(unchanged.getPasswordChangedAt()).isEqualTo(user.getPasswordChangedAt());
    }
}
