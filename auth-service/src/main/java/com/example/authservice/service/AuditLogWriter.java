package com.example.authservice.service;

import com.example.authservice.config.AsyncConfig;
import com.example.authservice.entity.AuditLog;
import com.example.authservice.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Persists best-effort audit entries off the request thread.
 *
 * Runs on the audit executor with no caller transaction, so the repository opens its own:
 * the entry survives a rolled-back caller, and the caller's connection is never paired
 * with a second one.
 */
@Component
public class AuditLogWriter {

    private static final Logger log = LoggerFactory.getLogger(AuditLogWriter.class);

    private final AuditLogRepository auditLogRepository;

    public AuditLogWriter(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Async(AsyncConfig.AUDIT_EXECUTOR)
    public void write(AuditLog entry) {
        try {
            auditLogRepository.saveAndFlush(entry);
            log.debug("Audit log created: {} {} on {}:{}", entry.getAction(), entry.getOutcome(),
                    entry.getResource(), entry.getResourceId());
        } catch (RuntimeException e) {
            log.error("Failed to create audit log: {} {} on {}:{}", entry.getAction(), entry.getOutcome(),
                    entry.getResource(), entry.getResourceId(), e);
        }
    }
}
