package com.archvalidation.domain.repository;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.TraceabilityMatrixEntry;

import java.util.Collection;
import java.util.List;

/**
 * Repository for the traceability matrix.
 */
public interface TraceabilityMatrixRepository {

    /**
     * Drop the tenant's matrix and store the given cells in its place.
     */
    void replace(String tenantId, Collection<TraceabilityMatrixEntry> entries);

    /**
     * Cells of the tenant, optionally restricted to a source and/or target layer.
     */
    List<TraceabilityMatrixEntry> find(String tenantId, ArchitectureLayer sourceLayer, ArchitectureLayer targetLayer);
}
