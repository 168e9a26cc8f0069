package com.example.authservice.service;

import com.example.authservice.dto.RequestMeta;
import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuditServiceIntegrationTest extends IntegrationTestSupport {

    private static final RequestMeta META = new RequestMeta("192.0.2.40", "JUnit");

    @Autowired
    private AuditService auditService;

    @Test
    void searchReturnsNewestFirst() {
        User actor = createUser("actor@x.com", Role.ADMIN1);

        auditService.record(AuditAction.USER_CREATED, AuditService.RESOURCE_USER, "first", actor, null, null, META);
        clock.advance(Duration.ofMinutes(1));
        auditService.record(AuditAction.USER_UPDATED, AuditService.RESOURCE_USER, "second", actor, null, null, META);
        clock.advance(Duration.ofMinutes(1));
        auditService.record(AuditAction.USER_LOCKED, AuditService.RESOURCE_USER, "third", actor, null, null, META);
        awaitAuditWrites();

        Page<AuditLog> page = auditService.search(actor.getId(), null, null, 1, 10);

        assertThat(page.getTotalElements()).isEqualTo(3);
        assertThat(page.getContent()).extracting(AuditLog::getResourceId)
                .containsExactly("third", "second", "first");
        assertThat(page.getContent()).extracting(AuditLog::getCreatedAt)
                .isSortedAccordingTo(Comparator.<LocalDateTime>reverseOrder());
    }

    @Test
    void entriesWithSameTimestampFallBackToInsertionOrderDescending() {
        User actor = createUser("same@x.com", Role.ADMIN1);

        for (int i = 1; i <= 3; i++) {
            auditService.record(AuditAction.PROFILE_UPDATED, AuditService.RESOURCE_USER, "r" + i, actor,
                    null, Map.of("n", i), META);
        }
        awaitAuditWrites();

        assertThat(auditService.search(actor.getId(), AuditAction.PROFILE_UPDATED, null, 1, 10).getContent())
                .extracting(AuditLog::getResourceId)
                .containsExactly("r3", "r2", "r1");
    }

    @Test
    void searchFiltersAndPaginates() {
        User actor = createUser("pager@x.com", Role.ADMIN1);
        for (int i = 0; i < 5; i++) {
            auditService.record(AuditAction.USER_UPDATED, AuditService.RESOURCE_USER, "u" + i, actor, null, null, META);
            clock.advance(Duration.ofSeconds(1));
        }
        auditService.record(AuditAction.SESSION_REVOKED, AuditService.RESOURCE_SESSION, "s", actor, null, null, META);
        awaitAuditWrites();

        Page<AuditLog> second = auditService.search(null, AuditAction.USER_UPDATED, null, 2, 2);

        assertThat(second.getTotalElements()).isEqualTo(5);
        assertThat(second.getTotalPages()).isEqualTo(3);
        assertThat(second.getContent()).extracting(AuditLog::getResourceId).containsExactly("u2", "u1");
        assertThat(auditService.search(null, null, AuditService.RESOURCE_SESSION, 1, 10).getContent())
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getActorId()).isEqualTo(actor.getId());
                    assertThat(entry.getActorEmail()).isEqualTo("pager@x.com");
                    assertThat(entry.getIpAddress()).isEqualTo("192.0.2.40");
                });
    }
}
