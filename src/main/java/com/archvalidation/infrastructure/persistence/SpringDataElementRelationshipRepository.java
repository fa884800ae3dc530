package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ElementRelationship;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for element relationships.
 */
@Repository
public interface SpringDataElementRelationshipRepository extends JpaRepository<ElementRelationship, UUID> {

    List<ElementRelationship> findByTenantId(String tenantId);

    long countByTenantId(String tenantId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ElementRelationship r WHERE r.tenantId = :tenantId")
    int deleteByTenant(@Param("tenantId") String tenantId);
}
