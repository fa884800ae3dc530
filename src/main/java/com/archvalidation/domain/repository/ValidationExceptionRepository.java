package com.archvalidation.domain.repository;

import com.archvalidation.domain.model.ValidationExceptionRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for tenant exceptions.
 */
public interface ValidationExceptionRepository {

    ValidationExceptionRecord save(ValidationExceptionRecord exception);

    Optional<ValidationExceptionRecord> findById(UUID id);

    /**
     * Exceptions of a tenant, newest first. Expiry is not considered here.
     */
    List<ValidationExceptionRecord> findByTenant(String tenantId, boolean includeInactive);

    long countActive();
}
