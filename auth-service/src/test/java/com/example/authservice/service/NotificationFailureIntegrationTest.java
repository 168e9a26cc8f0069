package com.example.authservice.service;

import com.example.authservice.dto.CreateUserRequest;
import com.example.authservice.dto.RequestMeta;
import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.notification.NotificationSender;
import com.example.authservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

/**
 * A broken mail channel must not fail the operation that triggered the mail.
 */
class NotificationFailureIntegrationTest extends IntegrationTestSupport {

    private static final RequestMeta META = new RequestMeta("192.0.2.10", "JUnit");

    @MockBean
    private NotificationSender notificationSender;

    @Autowired
    private AuthService authService;

    @Autowired
    private UserAdminService userAdminService;

    @BeforeEach
    void breakMailRelay() {
        doThrow(new IllegalStateException("mail relay unreachable"))
                .when(notificationSender).sendPasswordReset(any(User.class), anyString());
        doThrow(new IllegalStateException("mail relay unreachable"))
                .when(notificationSender).sendEmailVerification(any(User.class), anyString());
    }

    @Test
    void passwordResetRequestSurvivesDeliveryFailure() {
        User user = createUser("reset@x.com", Role.USER);

        assertThatCode(() -> authService.requestPasswordReset("reset@x.com", META))
                .doesNotThrowAnyException();

        verify(notificationSender).sendPasswordReset(any(User.class), anyString());
        assertThat(passwordResetRepository.findAll())
                .singleElement()
                .satisfies(request -> assertThat(request.getUser().getId()).isEqualTo(user.getId()));
        awaitAuditWrites();
        assertThat(auditLogRepository.findByActionOrderByIdAsc(AuditAction.PASSWORD_RESET_REQUESTED)).hasSize(1);
    }

    @Test
    void userCreationSurvivesVerificationMailFailure() {
        User superadmin = createUser("root@x.com", Role.SUPERADMIN);
        CreateUserRequest request = new CreateUserRequest("new@x.com", PASSWORD, "New", "User", Role.USER, null);

        User created = userAdminService.createUser(superadmin, request, META);

        verify(notificationSender).sendEmailVerification(any(User.class), anyString());
        assertThat(userRepository.findByEmail("new@x.com")).isPresent();
        assertThat(reload(created).isVerified()).isFalse();
    }
}
