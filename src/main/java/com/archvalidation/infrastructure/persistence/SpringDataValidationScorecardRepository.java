package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ValidationScorecard;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for scorecards.
 */
@Repository
public interface SpringDataValidationScorecardRepository extends JpaRepository<ValidationScorecard, UUID> {

    List<ValidationScorecard> findByTenantIdAndValidationCycleId(String tenantId, UUID cycleId);
}
