package com.archvalidation.domain.repository;

import com.archvalidation.domain.model.Severity;
import com.archvalidation.domain.model.ValidationIssue;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for validation issues.
 */
public interface ValidationIssueRepository {

    void saveAll(Collection<ValidationIssue> issues);

    ValidationIssue save(ValidationIssue issue);

    /**
     * Unscoped lookup; callers check the tenant themselves to tell 403 from 404.
     */
    Optional<ValidationIssue> findById(UUID id);

    /**
     * Issues matching the query, newest detection first.
     */
    List<ValidationIssue> find(IssueQuery query);

    long count(IssueQuery query);

    /**
     * Issue counts per severity over all of the tenant's issues.
     */
    Map<Severity, Long> countBySeverity(String tenantId);

    long countAll();

    long countUnresolved();
}
