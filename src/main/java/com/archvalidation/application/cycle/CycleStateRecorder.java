package com.archvalidation.application.cycle;

import com.archvalidation.application.exception.CycleAlreadyRunningException;
import com.archvalidation.domain.model.ValidationCycle;
import com.archvalidation.domain.repository.ValidationCycleRepository;
import com.archvalidation.infrastructure.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes cycle state changes in their own transactions, so that they are
 * visible to the worker and survive a rolled-back evaluation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CycleStateRecorder {

    private final ValidationCycleRepository cycleRepository;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Persist a new RUNNING cycle under an id already reserved in the {@link CycleRegistry}.
     *
     * @throws CycleAlreadyRunningException if the tenant has a running cycle, possibly started by another node
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ValidationCycle open(UUID cycleId, String tenantId, String triggeredBy, String ruleSetId) {
        if (cycleRepository.existsRunning(tenantId)) {
            throw new CycleAlreadyRunningException(tenantId, null);
        }
        ValidationCycle cycle = cycleRepository.save(
            ValidationCycle.start(cycleId, tenantId, triggeredBy, ruleSetId, clock.instant()));
        auditService.record(AuditService.CYCLE_STARTED, tenantId, cycle.getId().toString(),
            cycle.getTriggeredBy(), ruleSetId != null ? "rule_set_id=" + ruleSetId : null);
        return cycle;
    }

    /**
     * Move a running cycle to FAILED. A cycle that already ended is left alone.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<ValidationCycle> markFailed(UUID cycleId, String reason) {
        return cycleRepository.findById(cycleId)
            .filter(ValidationCycle::isRunning)
            .map(cycle -> {
                cycle.fail(reason, clock.instant());
                ValidationCycle saved = cycleRepository.save(cycle);
                auditService.record(AuditService.CYCLE_FAILED, cycle.getTenantId(), cycleId.toString(),
                    ValidationCycle.SYSTEM_TRIGGER, cycle.getFailureReason());
                log.warn("Validation cycle failed: cycle={}, tenant={}, reason={}",
                    cycleId, cycle.getTenantId(), cycle.getFailureReason());
                return saved;
            });
    }

    /**
     * Move a running cycle to CANCELLED. A cycle that already ended is left alone.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<ValidationCycle> markCancelled(UUID cycleId, String cancelledBy) {
        return cycleRepository.findById(cycleId)
            .filter(ValidationCycle::isRunning)
            .map(cycle -> {
                cycle.cancel(clock.instant());
                ValidationCycle saved = cycleRepository.save(cycle);
                auditService.record(AuditService.CYCLE_CANCELLED, cycle.getTenantId(), cycleId.toString(),
                    cancelledBy, null);
                log.warn("Validation cycle cancelled: cycle={}, tenant={}", cycleId, cycle.getTenantId());
                return saved;
            });
    }
}
