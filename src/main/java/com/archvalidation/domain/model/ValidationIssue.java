package com.archvalidation.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A modeling defect found by the rule evaluator.
 *
 * <p>Issues are created during a cycle and afterwards only change to record
 * their resolution. Resolution is idempotent: resolving twice keeps the first
 * resolver and timestamp.
 */
@Entity
@Table(name = "validation_issues", indexes = {
    @Index(name = "idx_validation_issues_tenant_detected", columnList = "tenant_id, detected_at"),
    @Index(name = "idx_validation_issues_cycle", columnList = "validation_cycle_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ValidationIssue {

    public static final int TEXT_MAX_LENGTH = 2000;
    public static final int METADATA_MAX_LENGTH = 4000;
    public static final String ELLIPSIS = "...";

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    /**
     * Null for issues recorded outside a cycle.
     */
    @Column(name = "validation_cycle_id", updatable = false)
    private UUID validationCycleId;

    @Column(name = "rule_id", updatable = false)
    private UUID ruleId;

    @Column(name = "entity_type", nullable = false, updatable = false, length = 100)
    private String entityType;

    @Column(name = "entity_id", nullable = false, updatable = false)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "layer", length = 20, updatable = false)
    private ArchitectureLayer layer;

    @Enumerated(EnumType.STRING)
    @Column(name = "issue_type", nullable = false, updatable = false, length = 30)
    private IssueType issueType;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, updatable = false, length = 20)
    private Severity severity;

    @Column(name = "description", nullable = false, updatable = false, length = TEXT_MAX_LENGTH)
    private String description;

    @Column(name = "recommended_fix", updatable = false, length = TEXT_MAX_LENGTH)
    private String recommendedFix;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", updatable = false, length = METADATA_MAX_LENGTH)
    private Map<String, Object> metadata;

    @Column(name = "detected_at", nullable = false, updatable = false)
    private Instant detectedAt;

    @Column(name = "is_resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Builder
    private ValidationIssue(
            String tenantId,
            UUID validationCycleId,
            UUID ruleId,
            String entityType,
            String entityId,
            ArchitectureLayer layer,
            IssueType issueType,
            Severity severity,
            String description,
            String recommendedFix,
            Map<String, Object> metadata,
            Instant detectedAt) {

        if (tenantId == null || entityType == null || entityId == null
                || issueType == null || severity == null || description == null) {
            throw new IllegalArgumentException("Issue requires tenant, entity, type, severity and description");
        }
        this.id = UUID.randomUUID();
        this.tenantId = tenantId;
        this.validationCycleId = validationCycleId;
        this.ruleId = ruleId;
        this.entityType = entityType;
        this.entityId = entityId;
        this.layer = layer;
        this.issueType = issueType;
        this.severity = severity;
        this.description = abbreviate(description, TEXT_MAX_LENGTH);
        this.recommendedFix = abbreviate(recommendedFix, TEXT_MAX_LENGTH);
        this.metadata = metadata != null ? new HashMap<>(metadata) : null;
        this.detectedAt = detectedAt != null ? detectedAt : Instant.now();
        this.resolved = false;
    }

    /**
     * Mark the issue resolved.
     *
     * @return true if the state changed, false if it was already resolved
     */
    public boolean resolve(String resolvedBy, Instant resolvedAt) {
        if (this.resolved) {
            return false;
        }
        this.resolved = true;
        this.resolvedBy = resolvedBy;
        this.resolvedAt = resolvedAt;
        return true;
    }

    /**
     * Cut text to at most {@code maxLength} characters, marking the cut with an ellipsis.
     */
    public static String abbreviate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    public boolean belongsTo(String tenant) {
        return tenantId.equals(tenant);
    }
}
