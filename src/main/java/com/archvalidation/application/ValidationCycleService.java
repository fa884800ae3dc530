package com.archvalidation.application;

import com.archvalidation.application.cycle.CancellationToken;
import com.archvalidation.application.cycle.CycleCancelledException;
import com.archvalidation.application.cycle.CycleRegistry;
import com.archvalidation.application.cycle.CycleStateRecorder;
import com.archvalidation.application.cycle.CycleTimeoutException;
import com.archvalidation.application.cycle.ValidationCycleRunner;
import com.archvalidation.application.exception.ResourceNotFoundException;
import com.archvalidation.config.PerformanceConfiguration.ValidationMetrics;
import com.archvalidation.config.ValidationProperties;
import com.archvalidation.domain.model.ValidationCycle;
import com.archvalidation.domain.repository.ValidationCycleRepository;
import com.archvalidation.infrastructure.security.SecurityContext;
import com.archvalidation.infrastructure.security.SecurityKernel;
import com.archvalidation.interfaces.api.dto.RunValidationRequest;
import com.archvalidation.interfaces.api.dto.ValidationCycleResponse;
import com.archvalidation.interfaces.api.dto.ValidationHistoryResponse;
import com.archvalidation.interfaces.api.dto.ValidationRunResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Application service for validation cycles: start, poll, cancel, history.
 *
 * <p>Starting a cycle commits the RUNNING cycle first and then evaluates it,
 * either on the cycle executor or inside the request when
 * {@code validation.cycle.synchronous} is set. A tenant has at most one
 * running cycle: the in-process registry slot is reserved before the cycle
 * row is written, and the row is only written when the tenant has no other
 * running cycle in the datastore.
 */
@Service
@Slf4j
public class ValidationCycleService {

    static final String TIMEOUT_REASON_PREFIX = "Timed out: ";

    private final ValidationCycleRepository cycleRepository;
    private final ValidationCycleRunner cycleRunner;
    private final CycleStateRecorder stateRecorder;
    private final CycleRegistry cycleRegistry;
    private final SecurityKernel securityKernel;
    private final SecurityContextProvider securityContextProvider;
    private final ValidationMetrics metrics;
    private final ValidationProperties properties;
    private final TaskExecutor cycleExecutor;

    public ValidationCycleService(
            ValidationCycleRepository cycleRepository,
            ValidationCycleRunner cycleRunner,
            CycleStateRecorder stateRecorder,
            CycleRegistry cycleRegistry,
            SecurityKernel securityKernel,
            SecurityContextProvider securityContextProvider,
            ValidationMetrics metrics,
            ValidationProperties properties,
            @Qualifier("validationCycleExecutor") TaskExecutor cycleExecutor) {
        this.cycleRepository = cycleRepository;
        this.cycleRunner = cycleRunner;
        this.stateRecorder = stateRecorder;
        this.cycleRegistry = cycleRegistry;
        this.securityKernel = securityKernel;
        this.securityContextProvider = securityContextProvider;
        this.metrics = metrics;
        this.properties = properties;
        this.cycleExecutor = cycleExecutor;
    }

    /**
     * Start a validation cycle for the caller's tenant.
     */
    public ValidationRunResponse startCycle(RunValidationRequest request) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        securityKernel.authorizeAdministration(context, "validation.run");

        String ruleSetId = request != null ? request.getRuleSetId() : null;
        UUID cycleId = UUID.randomUUID();

        // The registry slot is taken before the row exists, so a losing request writes nothing.
        CancellationToken token = cycleRegistry.register(cycleId, context.getTenantId());
        ValidationCycle cycle;
        try {
            cycle = stateRecorder.open(cycleId, context.getTenantId(), context.getPrincipalId(), ruleSetId);
        } catch (RuntimeException e) {
            cycleRegistry.release(cycleId);
            throw e;
        }
        metrics.recordCycleStarted();
        log.info("Validation cycle started: cycle={}, tenant={}, by={}, ruleSet={}",
            cycleId, context.getTenantId(), context.getPrincipalId(), ruleSetId);

        if (properties.getCycle().isSynchronous()) {
            ValidationCycle finished = execute(token);
            return ValidationRunResponse.builder()
                .validationCycleId(cycleId)
                .status(finished.getExecutionStatus())
                .message("Validation cycle finished")
                .cycle(toResponse(finished))
                .build();
        }

        try {
            cycleExecutor.execute(() -> execute(token));
        } catch (TaskRejectedException e) {
            cycleRegistry.release(cycleId);
            stateRecorder.markFailed(cycleId, "Validation queue is full");
            metrics.recordCycleFailed("rejected");
            throw e;
        }

        return ValidationRunResponse.builder()
            .validationCycleId(cycleId)
            .status(cycle.getExecutionStatus())
            .message("Validation cycle started")
            .cycle(toResponse(cycle))
            .build();
    }

    /**
     * Run a registered cycle and record its outcome. Never throws; the
     * outcome is on the returned cycle.
     */
    ValidationCycle execute(CancellationToken token) {
        UUID cycleId = token.getCycleId();
        try {
            return cycleRunner.run(cycleId, token);
        } catch (CycleCancelledException e) {
            metrics.recordCycleCancelled();
            return stateRecorder.markCancelled(cycleId, token.getCancelledBy())
                .orElseGet(() -> reload(cycleId));
        } catch (CycleTimeoutException e) {
            metrics.recordCycleFailed("timeout");
            return stateRecorder.markFailed(cycleId, TIMEOUT_REASON_PREFIX + e.getMessage())
                .orElseGet(() -> reload(cycleId));
        } catch (RuntimeException e) {
            log.error("Validation cycle {} failed unexpectedly", cycleId, e);
            metrics.recordCycleFailed("error");
            return stateRecorder.markFailed(cycleId, "Evaluation failed: " + e.getClass().getSimpleName())
                .orElseGet(() -> reload(cycleId));
        } finally {
            cycleRegistry.release(cycleId);
        }
    }

    @Transactional(readOnly = true)
    public ValidationCycleResponse getCycle(UUID cycleId) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        return toResponse(findOwnCycle(cycleId, context));
    }

    /**
     * Request cancellation of a running cycle of the caller's tenant.
     *
     * <p>A cycle running in this process stops at its next checkpoint. A
     * running cycle with no worker here is marked cancelled directly.
     */
    public ValidationCycleResponse cancelCycle(UUID cycleId) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        securityKernel.authorizeAdministration(context, "validation.cancel");

        ValidationCycle cycle = findOwnCycle(cycleId, context);
        if (!cycle.isRunning()) {
            throw new IllegalStateException(
                "Validation cycle " + cycleId + " is already " + cycle.getExecutionStatus().getValue());
        }

        if (cycleRegistry.cancel(cycleId, context.getPrincipalId())) {
            return toResponse(reload(cycleId));
        }

        log.warn("Cancelling cycle without a local worker: cycle={}, tenant={}", cycleId, context.getTenantId());
        metrics.recordCycleCancelled();
        return toResponse(stateRecorder.markCancelled(cycleId, context.getPrincipalId())
            .orElseGet(() -> reload(cycleId)));
    }

    @Transactional(readOnly = true)
    public ValidationHistoryResponse getHistory(int skip, int limit) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        String tenantId = context.getTenantId();

        List<ValidationCycleResponse> cycles = cycleRepository.findHistory(tenantId, skip, limit).stream()
            .map(ValidationCycleService::toResponse)
            .toList();

        return ValidationHistoryResponse.builder()
            .cycles(cycles)
            .totalCycles(cycleRepository.countByTenant(tenantId))
            .skip(skip)
            .limit(limit)
            .averageMaturityScore(cycleRepository.averageMaturity(tenantId).orElse(0.0))
            .lastValidationDate(cycleRepository.lastCompletedAt(tenantId).orElse(null))
            .build();
    }

    private ValidationCycle findOwnCycle(UUID cycleId, SecurityContext context) {
        return cycleRepository.findByIdAndTenant(cycleId, context.getTenantId())
            .orElseThrow(() -> ResourceNotFoundException.of("Validation cycle", cycleId));
    }

    private ValidationCycle reload(UUID cycleId) {
        return cycleRepository.findById(cycleId)
            .orElseThrow(() -> ResourceNotFoundException.of("Validation cycle", cycleId));
    }

    static ValidationCycleResponse toResponse(ValidationCycle cycle) {
        return ValidationCycleResponse.builder()
            .id(cycle.getId())
            .tenantId(cycle.getTenantId())
            .triggeredBy(cycle.getTriggeredBy())
            .ruleSetId(cycle.getRuleSetId())
            .startTime(cycle.getStartTime())
            .endTime(cycle.getEndTime())
            .executionStatus(cycle.getExecutionStatus())
            .totalIssuesFound(cycle.getTotalIssuesFound())
            .suppressedIssues(cycle.getSuppressedIssues())
            .rulesEvaluated(cycle.getRulesEvaluated())
            .elementsChecked(cycle.getElementsChecked())
            .maturityScore(cycle.getMaturityScore())
            .failureReason(cycle.getFailureReason())
            .createdAt(cycle.getCreatedAt())
            .updatedAt(cycle.getUpdatedAt())
            .build();
    }
}
