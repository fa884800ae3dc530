package com.archvalidation.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One execution of the rule evaluator for a tenant.
 *
 * <p><strong>State machine:</strong> {@code RUNNING -> COMPLETED | FAILED | CANCELLED}.
 * All three outcomes are terminal; a failed cycle is never retried, a new
 * cycle has to be started instead.
 *
 * <p>Cycles are kept indefinitely and make up the tenant's validation history.
 */
@Entity
@Table(name = "validation_cycles", indexes = {
    @Index(name = "idx_validation_cycles_tenant_start", columnList = "tenant_id, start_time")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ValidationCycle {

    public static final String SYSTEM_TRIGGER = "system";

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "start_time", nullable = false, updatable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    /**
     * User id of the caller, or {@link #SYSTEM_TRIGGER}.
     */
    @Column(name = "triggered_by", nullable = false, updatable = false)
    private String triggeredBy;

    @Column(name = "rule_set_id", updatable = false)
    private String ruleSetId;

    @Column(name = "total_issues_found", nullable = false)
    private int totalIssuesFound;

    @Column(name = "suppressed_issues", nullable = false)
    private int suppressedIssues;

    @Column(name = "rules_evaluated", nullable = false)
    private int rulesEvaluated;

    @Column(name = "elements_checked", nullable = false)
    private int elementsChecked;

    @Enumerated(EnumType.STRING)
    @Column(name = "execution_status", nullable = false, length = 20)
    private ExecutionStatus executionStatus;

    /**
     * Null until the cycle completes.
     */
    @Column(name = "maturity_score")
    private Double maturityScore;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    private ValidationCycle(UUID id, String tenantId, String triggeredBy, String ruleSetId, Instant startedAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.triggeredBy = triggeredBy;
        this.ruleSetId = ruleSetId;
        this.startTime = startedAt;
        this.executionStatus = ExecutionStatus.RUNNING;
        this.createdAt = startedAt;
        this.updatedAt = startedAt;
    }

    /**
     * Open a new cycle in the RUNNING state.
     *
     * @param tenantId Owning tenant
     * @param triggeredBy User id, or {@link #SYSTEM_TRIGGER}
     * @param ruleSetId Opaque rule set label (optional)
     * @param startedAt Start instant
     * @return New running cycle
     */
    public static ValidationCycle start(String tenantId, String triggeredBy, String ruleSetId, Instant startedAt) {
        return start(UUID.randomUUID(), tenantId, triggeredBy, ruleSetId, startedAt);
    }

    public static ValidationCycle start(
            UUID id, String tenantId, String triggeredBy, String ruleSetId, Instant startedAt) {
        if (id == null) {
            throw new IllegalArgumentException("Cycle id is required");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant id is required");
        }
        String trigger = (triggeredBy == null || triggeredBy.isBlank()) ? SYSTEM_TRIGGER : triggeredBy;
        return new ValidationCycle(id, tenantId, trigger, ruleSetId, startedAt);
    }

    /**
     * Record a successful evaluation.
     */
    public void complete(CycleStatistics statistics, double maturityScore, Instant completedAt) {
        requireRunning("complete");
        if (maturityScore < 0.0 || maturityScore > 1.0) {
            throw new IllegalArgumentException("Maturity score must be within [0,1]: " + maturityScore);
        }
        this.totalIssuesFound = statistics.issuesFound();
        this.suppressedIssues = statistics.suppressedIssues();
        this.rulesEvaluated = statistics.rulesEvaluated();
        this.elementsChecked = statistics.elementsChecked();
        this.maturityScore = maturityScore;
        this.executionStatus = ExecutionStatus.COMPLETED;
        this.endTime = completedAt;
        this.updatedAt = completedAt;
    }

    public void fail(String reason, Instant failedAt) {
        requireRunning("fail");
        this.executionStatus = ExecutionStatus.FAILED;
        this.failureReason = truncate(reason);
        this.endTime = failedAt;
        this.updatedAt = failedAt;
    }

    public void cancel(Instant cancelledAt) {
        requireRunning("cancel");
        this.executionStatus = ExecutionStatus.CANCELLED;
        this.failureReason = "Cancelled on request";
        this.endTime = cancelledAt;
        this.updatedAt = cancelledAt;
    }

    public boolean isRunning() {
        return executionStatus == ExecutionStatus.RUNNING;
    }

    public boolean belongsTo(String tenant) {
        return tenantId.equals(tenant);
    }

    private void requireRunning(String transition) {
        if (executionStatus.isTerminal()) {
            throw new IllegalStateException(
                "Cannot " + transition + " validation cycle " + id + " in state " + executionStatus.getValue());
        }
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() > 500 ? reason.substring(0, 500) : reason;
    }

    /**
     * Aggregate counters written on completion.
     */
    public record CycleStatistics(
        int issuesFound,
        int suppressedIssues,
        int rulesEvaluated,
        int elementsChecked
    ) {}
}
