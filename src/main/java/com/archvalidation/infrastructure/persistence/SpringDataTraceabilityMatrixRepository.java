package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.TraceabilityMatrixEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for traceability matrix cells.
 */
@Repository
public interface SpringDataTraceabilityMatrixRepository extends JpaRepository<TraceabilityMatrixEntry, UUID> {

    List<TraceabilityMatrixEntry> findByTenantId(String tenantId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TraceabilityMatrixEntry e WHERE e.tenantId = :tenantId")
    int deleteByTenant(@Param("tenantId") String tenantId);
}
