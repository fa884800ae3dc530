package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ExecutionStatus;
import com.archvalidation.domain.model.ValidationCycle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for validation cycles.
 */
@Repository
public interface SpringDataValidationCycleRepository extends JpaRepository<ValidationCycle, UUID> {

    Optional<ValidationCycle> findByIdAndTenantId(UUID id, String tenantId);

    boolean existsByTenantIdAndExecutionStatus(String tenantId, ExecutionStatus status);

    List<ValidationCycle> findByExecutionStatus(ExecutionStatus status);

    long countByTenantId(String tenantId);

    long countByExecutionStatus(ExecutionStatus status);

    Optional<ValidationCycle> findFirstByTenantIdAndExecutionStatusOrderByEndTimeDesc(
        String tenantId, ExecutionStatus status);

    @Query("SELECT AVG(c.maturityScore) FROM ValidationCycle c " +
           "WHERE c.tenantId = :tenantId AND c.executionStatus = :status")
    Double averageMaturityScore(@Param("tenantId") String tenantId, @Param("status") ExecutionStatus status);

    @Query("SELECT MAX(c.endTime) FROM ValidationCycle c " +
           "WHERE c.tenantId = :tenantId AND c.executionStatus = :status")
    Instant latestEndTime(@Param("tenantId") String tenantId, @Param("status") ExecutionStatus status);

    @Query("SELECT AVG(c.maturityScore) FROM ValidationCycle c WHERE c.executionStatus = :status")
    Double averageMaturityScore(@Param("status") ExecutionStatus status);
}
