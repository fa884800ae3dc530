package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ValidationExceptionRecord;
import com.archvalidation.domain.repository.ValidationExceptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing {@link ValidationExceptionRepository} with Spring Data JPA.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ValidationExceptionRepositoryAdapter implements ValidationExceptionRepository {

    private final SpringDataValidationExceptionRepository springDataRepository;

    @Override
    public ValidationExceptionRecord save(ValidationExceptionRecord exception) {
        ValidationExceptionRecord saved = springDataRepository.save(exception);
        log.debug("Validation exception persisted: id={}, tenant={}, entity={}:{}",
            saved.getId(), saved.getTenantId(), saved.getEntityType(), saved.getEntityId());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ValidationExceptionRecord> findById(UUID id) {
        return springDataRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ValidationExceptionRecord> findByTenant(String tenantId, boolean includeInactive) {
        return includeInactive
            ? springDataRepository.findByTenantIdOrderByCreatedAtDesc(tenantId)
            : springDataRepository.findByTenantIdAndActiveTrueOrderByCreatedAtDesc(tenantId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countActive() {
        return springDataRepository.countByActiveTrue();
    }
}
