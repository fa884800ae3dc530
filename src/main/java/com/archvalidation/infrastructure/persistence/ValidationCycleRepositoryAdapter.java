package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ExecutionStatus;
import com.archvalidation.domain.model.ValidationCycle;
import com.archvalidation.domain.repository.ValidationCycleRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing {@link ValidationCycleRepository} with Spring Data JPA.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ValidationCycleRepositoryAdapter implements ValidationCycleRepository {

    private final SpringDataValidationCycleRepository springDataRepository;

    @PersistenceContext
    private final EntityManager entityManager;

    @Override
    public ValidationCycle save(ValidationCycle cycle) {
        ValidationCycle saved = springDataRepository.save(cycle);
        log.debug("Validation cycle persisted: id={}, tenant={}, status={}",
            saved.getId(), saved.getTenantId(), saved.getExecutionStatus());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ValidationCycle> findById(UUID id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ValidationCycle> findByIdAndTenant(UUID id, String tenantId) {
        return springDataRepository.findByIdAndTenantId(id, tenantId);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsRunning(String tenantId) {
        return springDataRepository.existsByTenantIdAndExecutionStatus(tenantId, ExecutionStatus.RUNNING);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ValidationCycle> findAllRunning() {
        return springDataRepository.findByExecutionStatus(ExecutionStatus.RUNNING);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ValidationCycle> findHistory(String tenantId, int skip, int limit) {
        return entityManager.createQuery(
                "SELECT c FROM ValidationCycle c WHERE c.tenantId = :tenantId " +
                "ORDER BY c.startTime DESC, c.id", ValidationCycle.class)
            .setParameter("tenantId", tenantId)
            .setFirstResult(skip)
            .setMaxResults(limit)
            .getResultList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countByTenant(String tenantId) {
        return springDataRepository.countByTenantId(tenantId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ValidationCycle> findLatestCompleted(String tenantId) {
        return springDataRepository.findFirstByTenantIdAndExecutionStatusOrderByEndTimeDesc(
            tenantId, ExecutionStatus.COMPLETED);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Double> averageMaturity(String tenantId) {
        return Optional.ofNullable(springDataRepository.averageMaturityScore(tenantId, ExecutionStatus.COMPLETED));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Instant> lastCompletedAt(String tenantId) {
        return Optional.ofNullable(springDataRepository.latestEndTime(tenantId, ExecutionStatus.COMPLETED));
    }

    @Override
    @Transactional(readOnly = true)
    public long countAll() {
        return springDataRepository.count();
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(ExecutionStatus status) {
        return springDataRepository.countByExecutionStatus(status);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Double> averageMaturityOfAllTenants() {
        return Optional.ofNullable(springDataRepository.averageMaturityScore(ExecutionStatus.COMPLETED));
    }
}
