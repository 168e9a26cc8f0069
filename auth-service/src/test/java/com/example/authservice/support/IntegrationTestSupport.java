package com.example.authservice.support;

import com.example.authservice.config.AsyncConfig;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.repository.AuditLogRepository;
import com.example.authservice.repository.PasswordResetRequestRepository;
import com.example.authservice.repository.UserRepository;
import com.example.authservice.repository.UserSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Full application context on in-memory H2 with a hand-driven clock.
 * Tables are emptied before every test; tests run without a surrounding transaction.
 * Audit entries are written asynchronously: call {@link #awaitAuditWrites()} before reading them.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class IntegrationTestSupport {

    protected static final String PASSWORD = "Str0ng!Pw";

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    protected UserSessionRepository sessionRepository;

    @Autowired
    protected PasswordResetRequestRepository passwordResetRepository;

    @Autowired
    protected AuditLogRepository auditLogRepository;

    @Autowired
    protected PasswordEncoder passwordEncoder;

    @Autowired
    @Qualifier(AsyncConfig.AUDIT_EXECUTOR)
    private ThreadPoolTaskExecutor auditExecutor;

    @BeforeEach
    void cleanDatabase() {
        awaitAuditWrites();
        clock.reset();
        auditLogRepository.deleteAllInBatch();
        passwordResetRepository.deleteAllInBatch();
        sessionRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
    }

    protected User createUser(String email, Role role) {
        LocalDateTime now = LocalDateTime.now(clock);
        User user = new User();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(PASSWORD));
        user.setFirstName("Test");
        user.setLastName(role.getValue());
        user.setRole(role);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        user.setPasswordChangedAt(now);
        return userRepository.saveAndFlush(user);
    }

    protected User reload(User user) {
        return userRepository.findById(user.getId()).orElseThrow();
    }

    /**
     * Block until every audit write queued so far has run.
     * The test executor has a single worker, so a marker task completes after all earlier ones.
     */
    protected void awaitAuditWrites() {
        try {
            auditExecutor.submit(() -> { }).get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for audit writes", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Audit writes did not drain", e);
        }
    }
}
