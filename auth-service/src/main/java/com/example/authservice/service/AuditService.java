package com.example.authservice.service;

import com.example.authservice.dto.RequestMeta;
import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AuditWriteException;
import com.example.authservice.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Service for creating and browsing audit logs.
 *
 * 1. app.audit.mandatory=false (default): the entry is built on the caller's thread and
 *    persisted by {@link AuditLogWriter} on the audit executor, in its own transaction.
 *    It survives a rolled-back caller; a failed or rejected write is logged at ERROR.
 * 2. app.audit.mandatory=true: the entry joins the caller's transaction and a failure
 *    surfaces as AuditWriteException, rolling the operation back with it.
 * 3. Values are JSON; users are serialized through UserAuditDto (no passwordHash).
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String RESOURCE_USER = "user";
    public static final String RESOURCE_SESSION = "session";

    private final AuditLogRepository auditLogRepository;
    private final AuditLogWriter auditLogWriter;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean enabled;
    private final boolean mandatory;

    public AuditService(
            AuditLogRepository auditLogRepository,
            AuditLogWriter auditLogWriter,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${app.audit.enabled:true}") boolean enabled,
            @Value("${app.audit.mandatory:false}") boolean mandatory) {
        this.auditLogRepository = auditLogRepository;
        this.auditLogWriter = auditLogWriter;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.enabled = enabled;
        this.mandatory = mandatory;
    }

    /**
     * Record a successful action.
     */
    public void record(AuditAction action, String resource, String resourceId, User actor,
                       Object oldValues, Object newValues, RequestMeta meta) {
        record(action, resource, resourceId, actor, oldValues, newValues, AuditLog.AuditOutcome.SUCCESS, meta);
    }

    /**
     * Record an action with an explicit outcome.
     *
     * @param actor null for system or anonymous actions
     */
    public void record(AuditAction action, String resource, String resourceId, User actor,
                       Object oldValues, Object newValues, AuditLog.AuditOutcome outcome, RequestMeta meta) {
        if (!enabled) {
            return;
        }
        RequestMeta context = meta != null ? meta : RequestMeta.none();

        AuditLog entry = AuditLog.builder()
                .actor(actor)
                .action(action)
                .resource(resource)
                .resourceId(resourceId)
                .oldValues(toJson(oldValues))
                .newValues(toJson(newValues))
                .outcome(outcome)
                .ipAddress(context.ipAddress())
                .userAgent(context.userAgent())
                .createdAt(LocalDateTime.now(clock))
                .build();

        if (mandatory) {
            try {
                auditLogRepository.saveAndFlush(entry);
            } catch (RuntimeException e) {
                throw new AuditWriteException(action.getValue(), e);
            }
            log.debug("Audit log created: {} {} on {}:{}", action, outcome, resource, resourceId);
            return;
        }

        try {
            auditLogWriter.write(entry);
        } catch (RuntimeException e) {
            // Executor saturated or shut down
            log.error("Failed to queue audit log: {} {} on {}:{}", action, outcome, resource, resourceId, e);
        }
    }

    /**
     * Newest-first audit search. All filters are optional.
     *
     * @param page 1-based page number
     */
    @Transactional(readOnly = true)
    public Page<AuditLog> search(UUID actorId, AuditAction action, String resource, int page, int size) {
        return auditLogRepository.search(actorId, action, resource, PageRequest.of(Math.max(page, 1) - 1, size));
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit value of type {}", value.getClass().getSimpleName(), e);
            return null;
        }
    }
}
