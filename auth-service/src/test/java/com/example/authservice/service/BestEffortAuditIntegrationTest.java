package com.example.authservice.service;

import com.example.authservice.dto.LoginResponse;
import com.example.authservice.dto.RequestMeta;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.repository.AuditLogRepository;
import com.example.authservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Default audit policy: an audit store outage is logged and the operation still commits.
 */
class BestEffortAuditIntegrationTest extends IntegrationTestSupport {

    private static final RequestMeta META = new RequestMeta("192.0.2.20", "JUnit");

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
    void loginCommitsWhenAuditWriteFails() {
        User user = createUser("best@x.com", Role.USER);

        LoginResponse login = authService.login("best@x.com", PASSWORD, false, META);

        assertThat(login.accessToken()).isNotBlank();
        assertThat(sessionRepository.countByUserAndActiveTrue(user)).isEqualTo(1);
        assertThat(reload(user).getLastLogin()).isNotNull();

        awaitAuditWrites();
        verify(auditStore).saveAndFlush(any(AuditLog.class));
    }

    @Test
    void passwordChangeCommitsWhenAuditWriteFails() {
        User user = createUser("change@x.com", Role.USER);
        authService.login("change@x.com", PASSWORD, false, META);

        userService.changePassword(user, PASSWORD, "N3w!Passw0rd", META);

        User changed = reload(user);
        assertThat(passwordEncoder.matches("N3w!Passw0rd", changed.getPasswordHash())).isTrue();
        assertThat(sessionRepository.countByUserAndActiveTrue(user)).isZero();

        awaitAuditWrites();
        verify(auditStore, atLeast(2)).saveAndFlush(any(AuditLog.class));
    }
}
