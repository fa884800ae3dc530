package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.ElementRelationship;
import com.archvalidation.domain.repository.ArchitectureModelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Adapter implementing {@link ArchitectureModelRepository} with Spring Data JPA.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ArchitectureModelRepositoryAdapter implements ArchitectureModelRepository {

    private final SpringDataArchitectureElementRepository elementRepository;
    private final SpringDataElementRelationshipRepository relationshipRepository;

    @Override
    @Transactional(readOnly = true)
    public List<ArchitectureElement> findElements(String tenantId) {
        return elementRepository.findByTenantIdOrderByElementTypeAscElementIdAsc(tenantId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ElementRelationship> findRelationships(String tenantId) {
        return relationshipRepository.findByTenantId(tenantId);
    }

    @Override
    public void saveElements(Collection<ArchitectureElement> elements) {
        elementRepository.saveAll(elements);
    }

    @Override
    public void saveRelationships(Collection<ElementRelationship> relationships) {
        relationshipRepository.saveAll(relationships);
    }

    @Override
    public void deleteModel(String tenantId) {
        int relationships = relationshipRepository.deleteByTenant(tenantId);
        int elements = elementRepository.deleteByTenant(tenantId);
        log.warn("Architecture model cleared: tenant={}, elements={}, relationships={}",
            tenantId, elements, relationships);
    }

    @Override
    @Transactional(readOnly = true)
    public long countRelationships(String tenantId) {
        return relationshipRepository.countByTenantId(tenantId);
    }
}
