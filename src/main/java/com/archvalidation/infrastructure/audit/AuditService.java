package com.archvalidation.infrastructure.audit;

/**
 * Records domain events of the validation engine.
 *
 * <p>Events are logged and written to the outbox table, from which
 * {@link OutboxPublisher} forwards them. Recording never fails the caller.
 */
public interface AuditService {

    String CYCLE_STARTED = "validation.cycle.started";
    String CYCLE_COMPLETED = "validation.completed";
    String CYCLE_FAILED = "validation.cycle.failed";
    String CYCLE_CANCELLED = "validation.cycle.cancelled";
    String ISSUE_RESOLVED = "validation.issue.resolved";
    String EXCEPTION_CREATED = "validation.exception.created";
    String EXCEPTION_DEACTIVATED = "validation.exception.deactivated";
    String RULE_CREATED = "validation.rule.created";
    String RULE_UPDATED = "validation.rule.updated";
    String MODEL_IMPORTED = "validation.model.imported";

    /**
     * @param eventType One of the event type constants
     * @param tenantId Tenant the event belongs to, or null for global events
     * @param resourceId Id of the affected resource
     * @param principalId User id of the actor, or {@code system}
     * @param detail Short free-form detail
     */
    void record(String eventType, String tenantId, String resourceId, String principalId, String detail);
}
