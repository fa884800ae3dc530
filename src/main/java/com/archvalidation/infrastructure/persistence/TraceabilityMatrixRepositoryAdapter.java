package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.TraceabilityMatrixEntry;
import com.archvalidation.domain.repository.TraceabilityMatrixRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Adapter implementing {@link TraceabilityMatrixRepository} with Spring Data JPA.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class TraceabilityMatrixRepositoryAdapter implements TraceabilityMatrixRepository {

    private static final Comparator<TraceabilityMatrixEntry> CELL_ORDER = Comparator
        .comparing(TraceabilityMatrixEntry::getSourceLayer)
        .thenComparing(TraceabilityMatrixEntry::getTargetLayer)
        .thenComparing(TraceabilityMatrixEntry::getSourceEntityType)
        .thenComparing(TraceabilityMatrixEntry::getTargetEntityType)
        .thenComparing(TraceabilityMatrixEntry::getRelationshipType);

    private final SpringDataTraceabilityMatrixRepository springDataRepository;

    @Override
    public void replace(String tenantId, Collection<TraceabilityMatrixEntry> entries) {
        int removed = springDataRepository.deleteByTenant(tenantId);
        springDataRepository.saveAll(entries);
        log.info("Traceability matrix rebuilt: tenant={}, removed={}, written={}",
            tenantId, removed, entries.size());
    }

    @Override
    @Transactional(readOnly = true)
    public List<TraceabilityMatrixEntry> find(String tenantId, ArchitectureLayer sourceLayer, ArchitectureLayer targetLayer) {
        return springDataRepository.findByTenantId(tenantId).stream()
            .filter(entry -> sourceLayer == null || entry.getSourceLayer() == sourceLayer)
            .filter(entry -> targetLayer == null || entry.getTargetLayer() == targetLayer)
            .sorted(CELL_ORDER)
            .toList();
    }
}
