package com.example.authservice.scheduler;

import com.example.authservice.service.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Periodic sweep of expired sessions.
 *
 * - @SchedulerLock: one replica per tick
 * - Delegates to SessionService; the sweep is idempotent
 * - Disabled with app.sessions.cleanup.enabled=false
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "app.sessions.cleanup.enabled", havingValue = "true", matchIfMissing = true)
public class SessionCleanupScheduler {

    private final SessionService sessionService;

    /**
     * Default: every 15 minutes.
     */
    @Scheduled(cron = "${app.sessions.cleanup.cron:0 */15 * * * *}")
    @SchedulerLock(
            name = "sweepExpiredSessions",
            lockAtMostFor = "10m",
            lockAtLeastFor = "30s"
    )
    public void sweepExpiredSessions() {
        String correlationId = "SCHEDULER-SESSIONS-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            int deactivated = sessionService.sweepExpired();
            if (deactivated > 0) {
                log.info("Session sweep deactivated {} expired session(s)", deactivated);
            } else {
                log.debug("Session sweep found no expired sessions");
            }
        } catch (Exception e) {
            log.error("Error in scheduled session sweep: {}", e.getMessage(), e);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
