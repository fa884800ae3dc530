package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ValidationRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for validation rules.
 */
@Repository
public interface SpringDataValidationRuleRepository extends JpaRepository<ValidationRule, UUID> {

    boolean existsByNameIgnoreCase(String name);

    List<ValidationRule> findAllByOrderByNameAsc();

    List<ValidationRule> findByActiveTrueOrderByNameAsc();

    long countByActiveTrue();
}
