package com.archvalidation.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * An administrator-approved exception: an intentional modeling gap that the
 * evaluator must not report.
 *
 * <p>An exception is <em>effective</em> only while it is active and not
 * expired. Expiry is evaluated against the caller's clock; the stored
 * {@code is_active} flag is not rewritten when an exception lapses.
 */
@Entity
@Table(name = "validation_exceptions", indexes = {
    @Index(name = "idx_validation_exceptions_tenant_entity", columnList = "tenant_id, entity_type, entity_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ValidationExceptionRecord {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "entity_type", nullable = false, updatable = false, length = 100)
    private String entityType;

    @Column(name = "entity_id", nullable = false, updatable = false)
    private String entityId;

    /**
     * Null means the exception covers every rule.
     */
    @Column(name = "rule_id", updatable = false)
    private UUID ruleId;

    @Column(name = "reason", nullable = false, updatable = false, length = 2000)
    private String reason;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    private ValidationExceptionRecord(
            UUID id,
            String tenantId,
            String entityType,
            String entityId,
            UUID ruleId,
            String reason,
            String createdBy,
            Instant createdAt,
            Instant expiresAt) {

        this.id = id;
        this.tenantId = tenantId;
        this.entityType = entityType;
        this.entityId = entityId;
        this.ruleId = ruleId;
        this.reason = reason;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.active = true;
    }

    public static ValidationExceptionRecord create(
            String tenantId,
            String entityType,
            String entityId,
            UUID ruleId,
            String reason,
            String createdBy,
            Instant createdAt,
            Instant expiresAt) {

        if (expiresAt != null && !expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("Exception expiry must be in the future");
        }
        return new ValidationExceptionRecord(
            UUID.randomUUID(), tenantId, entityType, entityId, ruleId, reason, createdBy, createdAt, expiresAt);
    }

    /**
     * Active and not yet expired at {@code now}.
     */
    public boolean isEffectiveAt(Instant now) {
        return active && (expiresAt == null || expiresAt.isAfter(now));
    }

    /**
     * Whether this exception covers an issue on the given entity raised by the given rule.
     * Does not consider activation or expiry; see {@link #isEffectiveAt(Instant)}.
     */
    public boolean covers(String issueEntityType, String issueEntityId, UUID issueRuleId) {
        if (!entityType.equals(issueEntityType) || !entityId.equals(issueEntityId)) {
            return false;
        }
        return ruleId == null || ruleId.equals(issueRuleId);
    }

    public void deactivate() {
        this.active = false;
    }

    public boolean belongsTo(String tenant) {
        return tenantId.equals(tenant);
    }
}
