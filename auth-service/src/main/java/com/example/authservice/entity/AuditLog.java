package com.example.authservice.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Audit Log entity for tracking security-sensitive operations.
 *
 * - Immutable: getters only, rows are never updated or deleted
 * - actor_id is a weak reference (no FK) so entries outlive the user; NULL = system/anonymous
 * - actor_email denormalized for browsing without a JOIN
 * - old_values/new_values hold JSON snapshots as TEXT
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_logs_actor_id", columnList = "actor_id"),
    @Index(name = "idx_audit_logs_action", columnList = "action"),
    @Index(name = "idx_audit_logs_resource", columnList = "resource, resource_id"),
    @Index(name = "idx_audit_logs_created_at", columnList = "created_at")
})
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Who
    @Column(name = "actor_id")
    private UUID actorId;

    @Column(name = "actor_email", length = 255)
    private String actorEmail;

    // What
    @Column(nullable = false, length = 50)
    @Enumerated(EnumType.STRING)
    private AuditAction action;

    @Column(length = 100)
    private String resource;

    @Column(name = "resource_id", length = 100)
    private String resourceId;

    @Column(name = "old_values", columnDefinition = "TEXT")
    private String oldValues;

    @Column(name = "new_values", columnDefinition = "TEXT")
    private String newValues;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private AuditOutcome outcome = AuditOutcome.SUCCESS;

    // Request context
    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum AuditOutcome {
        SUCCESS,
        FAILURE,  // e.g. wrong password
        DENIED    // e.g. account locked or inactive
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    protected AuditLog() {
    }

    private AuditLog(Builder builder) {
        this.actorId = builder.actorId;
        this.actorEmail = builder.actorEmail;
        this.action = builder.action;
        this.resource = builder.resource;
        this.resourceId = builder.resourceId;
        this.oldValues = builder.oldValues;
        this.newValues = builder.newValues;
        this.outcome = builder.outcome;
        this.ipAddress = builder.ipAddress;
        this.userAgent = builder.userAgent;
        this.createdAt = builder.createdAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID actorId;
        private String actorEmail;
        private AuditAction action;
        private String resource;
        private String resourceId;
        private String oldValues;
        private String newValues;
        private AuditOutcome outcome = AuditOutcome.SUCCESS;
        private String ipAddress;
        private String userAgent;
        private LocalDateTime createdAt;

        public Builder actor(User actor) {
            if (actor != null) {
                this.actorId = actor.getId();
                this.actorEmail = actor.getEmail();
            }
            return this;
        }

        public Builder actorEmail(String actorEmail) {
            this.actorEmail = actorEmail;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        public Builder oldValues(String oldValues) {
            this.oldValues = oldValues;
            return this;
        }

        public Builder newValues(String newValues) {
            this.newValues = newValues;
            return this;
        }

        public Builder outcome(AuditOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder createdAt(LocalDateTime createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public AuditLog build() {
            return new AuditLog(this);
        }
    }

    // Getters only (immutable)
    public Long getId() { return id; }
    public UUID getActorId() { return actorId; }
    public String getActorEmail() { return actorEmail; }
    public AuditAction getAction() { return action; }
    public String getResource() { return resource; }
    public String getResourceId() { return resourceId; }
    public String getOldValues() { return oldValues; }
    public String getNewValues() { return newValues; }
    public AuditOutcome getOutcome() { return outcome; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
