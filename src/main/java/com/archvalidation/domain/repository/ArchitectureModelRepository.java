package com.archvalidation.domain.repository;

import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.ElementRelationship;

import java.util.Collection;
import java.util.List;

/**
 * Repository for the tenant's imported architecture model.
 */
public interface ArchitectureModelRepository {

    List<ArchitectureElement> findElements(String tenantId);

    List<ElementRelationship> findRelationships(String tenantId);

    void saveElements(Collection<ArchitectureElement> elements);

    void saveRelationships(Collection<ElementRelationship> relationships);

    /**
     * Remove every element and relationship of the tenant.
     */
    void deleteModel(String tenantId);

    long countRelationships(String tenantId);
}
