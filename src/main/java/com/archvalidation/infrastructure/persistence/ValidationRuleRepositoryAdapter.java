package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ValidationRule;
import com.archvalidation.domain.repository.ValidationRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing {@link ValidationRuleRepository} with Spring Data JPA.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ValidationRuleRepositoryAdapter implements ValidationRuleRepository {

    private final SpringDataValidationRuleRepository springDataRepository;

    @Override
    public ValidationRule save(ValidationRule rule) {
        ValidationRule saved = springDataRepository.save(rule);
        log.debug("Validation rule persisted: id={}, name={}, active={}",
            saved.getId(), saved.getName(), saved.isActive());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ValidationRule> findById(UUID id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsById(UUID id) {
        return springDataRepository.existsById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByName(String name) {
        return springDataRepository.existsByNameIgnoreCase(name);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ValidationRule> findAll() {
        return springDataRepository.findAllByOrderByNameAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ValidationRule> findActive() {
        return springDataRepository.findByActiveTrueOrderByNameAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return springDataRepository.count();
    }

    @Override
    @Transactional(readOnly = true)
    public long countActive() {
        return springDataRepository.countByActiveTrue();
    }
}
