package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ArchitectureElement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for architecture elements.
 */
@Repository
public interface SpringDataArchitectureElementRepository extends JpaRepository<ArchitectureElement, UUID> {

    List<ArchitectureElement> findByTenantIdOrderByElementTypeAscElementIdAsc(String tenantId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ArchitectureElement e WHERE e.tenantId = :tenantId")
    int deleteByTenant(@Param("tenantId") String tenantId);
}
