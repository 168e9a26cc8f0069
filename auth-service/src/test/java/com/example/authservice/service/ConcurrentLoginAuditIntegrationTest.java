package com.example.authservice.service;

import com.example.authservice.dto.RequestMeta;
import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.exception.InvalidCredentialsException;
import com.example.authservice.support.IntegrationTestSupport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * As many concurrent failed logins as there are pooled connections.
 * Each login holds one connection for its transaction; audit entries must neither
 * stall the requests nor get lost.
 */
@Slf4j
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:h2:mem:authdb-concurrent;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;LOCK_TIMEOUT=20000",
        "spring.datasource.hikari.maximum-pool-size=" + ConcurrentLoginAuditIntegrationTest.POOL_SIZE,
        "spring.datasource.hikari.connection-timeout=" + ConcurrentLoginAuditIntegrationTest.CONNECTION_TIMEOUT_MS
})
class ConcurrentLoginAuditIntegrationTest extends IntegrationTestSupport {

    static final int POOL_SIZE = 4;
    static final long CONNECTION_TIMEOUT_MS = 10_000;

    private static final RequestMeta META = new RequestMeta("198.51.100.4", "JUnit");

    @Autowired
    private AuthService authService;

    @Test
    void concurrentFailedLoginsAreAllAuditedWithoutWaitingForConnections() throws Exception {
        User user = createUser("burst@x.com", Role.USER);

        ExecutorService callers = Executors.newFixedThreadPool(POOL_SIZE);
        CountDownLatch start = new CountDownLatch(1);
        Callable<Class<?>> failedLogin = () -> {
            start.await();
            try {
                authService.login("burst@x.com", "wrong-password", false, META);
                return null;
            } catch (RuntimeException e) {
                return e.getClass();
            }
        };
        List<Future<Class<?>>> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < POOL_SIZE; i++) {
                outcomes.add(callers.submit(failedLogin));
            }

            long startedAt = System.nanoTime();
            start.countDown();
            List<Class<?>> failures = new ArrayList<>();
            for (Future<Class<?>> outcome : outcomes) {
                failures.add(outcome.get(30, TimeUnit.SECONDS));
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
            log.info("{} concurrent failed logins finished in {} ms", POOL_SIZE, elapsedMs);

            assertThat(failures).hasSize(POOL_SIZE).allMatch(InvalidCredentialsException.class::equals);
            // A request waiting on a second connection would sit out the full pool timeout
            assertThat(elapsedMs).isLessThan(CONNECTION_TIMEOUT_MS);
        } finally {
            callers.shutdownNow();
        }

        awaitAuditWrites();
        assertThat(reload(user).getFailedLoginAttempts()).isEqualTo(POOL_SIZE);
        assertThat(auditLogRepository.findByActionOrderByIdAsc(AuditAction.LOGIN_FAILED)).hasSize(POOL_SIZE);
    }
}
