package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ValidationExceptionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for tenant exceptions.
 */
@Repository
public interface SpringDataValidationExceptionRepository extends JpaRepository<ValidationExceptionRecord, UUID> {

    List<ValidationExceptionRecord> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    List<ValidationExceptionRecord> findByTenantIdAndActiveTrueOrderByCreatedAtDesc(String tenantId);

    long countByActiveTrue();
}
