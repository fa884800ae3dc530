package com.archvalidation.domain.repository;

import com.archvalidation.domain.model.ExecutionStatus;
import com.archvalidation.domain.model.ValidationCycle;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for validation cycles.
 *
 * <p>Lookups that take a tenant id never return another tenant's cycle.
 */
public interface ValidationCycleRepository {

    ValidationCycle save(ValidationCycle cycle);

    Optional<ValidationCycle> findById(UUID id);

    Optional<ValidationCycle> findByIdAndTenant(UUID id, String tenantId);

    /**
     * Whether the tenant has a cycle in the RUNNING state.
     */
    boolean existsRunning(String tenantId);

    /**
     * Running cycles of every tenant, used by startup recovery.
     */
    List<ValidationCycle> findAllRunning();

    /**
     * Cycles of a tenant, newest start first.
     */
    List<ValidationCycle> findHistory(String tenantId, int skip, int limit);

    long countByTenant(String tenantId);

    Optional<ValidationCycle> findLatestCompleted(String tenantId);

    /**
     * Mean maturity score over the tenant's completed cycles.
     */
    Optional<Double> averageMaturity(String tenantId);

    Optional<Instant> lastCompletedAt(String tenantId);

    long countAll();

    long countByStatus(ExecutionStatus status);

    Optional<Double> averageMaturityOfAllTenants();
}
