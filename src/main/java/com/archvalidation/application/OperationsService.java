package com.archvalidation.application;

import com.archvalidation.application.cycle.CycleRegistry;
import com.archvalidation.domain.model.ExecutionStatus;
import com.archvalidation.domain.repository.ValidationCycleRepository;
import com.archvalidation.domain.repository.ValidationExceptionRepository;
import com.archvalidation.domain.repository.ValidationIssueRepository;
import com.archvalidation.domain.repository.ValidationRuleRepository;
import com.archvalidation.interfaces.api.dto.HealthResponse;
import com.archvalidation.interfaces.api.dto.MetricsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated health and aggregate counters of the service.
 * Nothing returned here identifies a tenant.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OperationsService {

    public static final String STATUS_UP = "healthy";
    public static final String STATUS_DOWN = "unhealthy";
    static final String SERVICE_NAME = "architecture-validation";

    private final ValidationCycleRepository cycleRepository;
    private final ValidationIssueRepository issueRepository;
    private final ValidationRuleRepository ruleRepository;
    private final ValidationExceptionRepository exceptionRepository;
    private final CycleRegistry cycleRegistry;
    private final Clock clock;

    /**
     * Check the datastore. Never throws; a failed check yields {@link #STATUS_DOWN}.
     */
    public HealthResponse health() {
        Map<String, String> components = new LinkedHashMap<>();
        String status = STATUS_UP;
        try {
            cycleRepository.countAll();
            components.put("database", "up");
        } catch (DataAccessException | TransactionException e) {
            log.warn("Health check: datastore unavailable - {}", e.getMessage());
            components.put("database", "down");
            status = STATUS_DOWN;
        }
        components.put("running_cycles", String.valueOf(cycleRegistry.size()));

        return HealthResponse.builder()
            .status(status)
            .service(SERVICE_NAME)
            .timestamp(clock.instant())
            .components(components)
            .build();
    }

    @Transactional(readOnly = true)
    public MetricsResponse metrics() {
        return MetricsResponse.builder()
            .totalValidations(cycleRepository.countAll())
            .completedValidations(cycleRepository.countByStatus(ExecutionStatus.COMPLETED))
            .failedValidations(cycleRepository.countByStatus(ExecutionStatus.FAILED))
            .cancelledValidations(cycleRepository.countByStatus(ExecutionStatus.CANCELLED))
            .runningValidations(cycleRepository.countByStatus(ExecutionStatus.RUNNING))
            .totalIssues(issueRepository.countAll())
            .unresolvedIssues(issueRepository.countUnresolved())
            .totalRules(ruleRepository.count())
            .activeRules(ruleRepository.countActive())
            .activeExceptions(exceptionRepository.countActive())
            .averageMaturityScore(cycleRepository.averageMaturityOfAllTenants().orElse(0.0))
            .timestamp(clock.instant())
            .build();
    }
}
