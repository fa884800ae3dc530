package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.Severity;
import com.archvalidation.domain.model.ValidationIssue;
import com.archvalidation.domain.repository.IssueQuery;
import com.archvalidation.domain.repository.ValidationIssueRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing {@link ValidationIssueRepository} with Spring Data JPA.
 *
 * <p>Listings are always filtered by tenant in the query itself.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ValidationIssueRepositoryAdapter implements ValidationIssueRepository {

    private final SpringDataValidationIssueRepository springDataRepository;

    @PersistenceContext
    private final EntityManager entityManager;

    @Override
    public void saveAll(Collection<ValidationIssue> issues) {
        springDataRepository.saveAll(issues);
        log.debug("Validation issues persisted: count={}", issues.size());
    }

    @Override
    public ValidationIssue save(ValidationIssue issue) {
        return springDataRepository.save(issue);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ValidationIssue> findById(UUID id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ValidationIssue> find(IssueQuery query) {
        TypedQuery<ValidationIssue> typed = entityManager.createQuery(
            "SELECT i FROM ValidationIssue i" + whereClause(query) + " ORDER BY i.detectedAt DESC, i.id",
            ValidationIssue.class);
        bind(typed, query);
        return typed
            .setFirstResult(query.skip())
            .setMaxResults(query.limit())
            .getResultList();
    }

    @Override
    @Transactional(readOnly = true)
    public long count(IssueQuery query) {
        TypedQuery<Long> typed = entityManager.createQuery(
            "SELECT COUNT(i) FROM ValidationIssue i" + whereClause(query), Long.class);
        bind(typed, query);
        return typed.getSingleResult();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Severity, Long> countBySeverity(String tenantId) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        for (Object[] row : springDataRepository.countGroupedBySeverity(tenantId)) {
            counts.put((Severity) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public long countAll() {
        return springDataRepository.count();
    }

    @Override
    @Transactional(readOnly = true)
    public long countUnresolved() {
        return springDataRepository.countByResolvedFalse();
    }

    private static String whereClause(IssueQuery query) {
        StringBuilder where = new StringBuilder(" WHERE i.tenantId = :tenantId");
        if (query.validationCycleId() != null) {
            where.append(" AND i.validationCycleId = :cycleId");
        }
        if (query.severity() != null) {
            where.append(" AND i.severity = :severity");
        }
        if (query.resolved() != null) {
            where.append(" AND i.resolved = :resolved");
        }
        return where.toString();
    }

    private static void bind(TypedQuery<?> typed, IssueQuery query) {
        typed.setParameter("tenantId", query.tenantId());
        if (query.validationCycleId() != null) {
            typed.setParameter("cycleId", query.validationCycleId());
        }
        if (query.severity() != null) {
            typed.setParameter("severity", query.severity());
        }
        if (query.resolved() != null) {
            typed.setParameter("resolved", query.resolved());
        }
    }
}
