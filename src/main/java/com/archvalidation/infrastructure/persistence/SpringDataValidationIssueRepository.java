package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ValidationIssue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for validation issues.
 */
@Repository
public interface SpringDataValidationIssueRepository extends JpaRepository<ValidationIssue, UUID> {

    /**
     * Rows of (severity, count) for one tenant.
     */
    @Query("SELECT i.severity, COUNT(i) FROM ValidationIssue i WHERE i.tenantId = :tenantId GROUP BY i.severity")
    List<Object[]> countGroupedBySeverity(@Param("tenantId") String tenantId);

    long countByResolvedFalse();
}
