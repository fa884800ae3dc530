package com.archvalidation.infrastructure.persistence;

import com.archvalidation.domain.model.ValidationScorecard;
import com.archvalidation.domain.repository.ValidationScorecardRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Adapter implementing {@link ValidationScorecardRepository} with Spring Data JPA.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ValidationScorecardRepositoryAdapter implements ValidationScorecardRepository {

    private final SpringDataValidationScorecardRepository springDataRepository;

    @Override
    public void saveAll(Collection<ValidationScorecard> scorecards) {
        springDataRepository.saveAll(scorecards);
        log.debug("Scorecards persisted: count={}", scorecards.size());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ValidationScorecard> findByCycle(String tenantId, UUID cycleId) {
        // layer column holds enum names; sort by declaration order instead
        return springDataRepository.findByTenantIdAndValidationCycleId(tenantId, cycleId).stream()
            .sorted(Comparator.comparing(ValidationScorecard::getLayer))
            .toList();
    }
}
