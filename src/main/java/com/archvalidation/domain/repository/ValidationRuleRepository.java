package com.archvalidation.domain.repository;

import com.archvalidation.domain.model.ValidationRule;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the global rule set.
 */
public interface ValidationRuleRepository {

    ValidationRule save(ValidationRule rule);

    Optional<ValidationRule> findById(UUID id);

    boolean existsById(UUID id);

    boolean existsByName(String name);

    /**
     * All rules ordered by name.
     */
    List<ValidationRule> findAll();

    List<ValidationRule> findActive();

    long count();

    long countActive();
}
