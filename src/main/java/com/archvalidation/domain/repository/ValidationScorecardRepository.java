package com.archvalidation.domain.repository;

import com.archvalidation.domain.model.ValidationScorecard;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for per-layer scorecards. Scorecards are written once and only read afterwards.
 */
public interface ValidationScorecardRepository {

    void saveAll(Collection<ValidationScorecard> scorecards);

    /**
     * Scorecards of one cycle in layer order; empty if the cycle belongs to another tenant.
     */
    List<ValidationScorecard> findByCycle(String tenantId, UUID cycleId);
}
