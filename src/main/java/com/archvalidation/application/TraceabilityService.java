package com.archvalidation.application;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.TraceabilityMatrixEntry;
import com.archvalidation.domain.model.ValidationRule;
import com.archvalidation.domain.repository.ArchitectureModelRepository;
import com.archvalidation.domain.repository.TraceabilityMatrixRepository;
import com.archvalidation.domain.repository.ValidationExceptionRepository;
import com.archvalidation.domain.repository.ValidationRuleRepository;
import com.archvalidation.domain.rules.ArchitectureGraph;
import com.archvalidation.domain.rules.ExceptionOverlay;
import com.archvalidation.domain.rules.MissingLinkObservation;
import com.archvalidation.domain.rules.RuleEvaluator;
import com.archvalidation.domain.scoring.TraceabilityMatrixBuilder;
import com.archvalidation.infrastructure.security.SecurityContext;
import com.archvalidation.infrastructure.security.SecurityKernel;
import com.archvalidation.interfaces.api.dto.TraceabilityMatrixEntryResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Application service for the traceability matrix.
 *
 * <p>The matrix is rebuilt by every completed cycle. An on-demand refresh
 * re-evaluates the active rules without recording issues, only to collect
 * the missing links.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class TraceabilityService {

    private final TraceabilityMatrixRepository matrixRepository;
    private final ArchitectureModelRepository modelRepository;
    private final ValidationRuleRepository ruleRepository;
    private final ValidationExceptionRepository exceptionRepository;
    private final RuleEvaluator ruleEvaluator;
    private final SecurityKernel securityKernel;
    private final SecurityContextProvider securityContextProvider;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<TraceabilityMatrixEntryResponse> getMatrix(ArchitectureLayer sourceLayer, ArchitectureLayer targetLayer) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        return matrixRepository.find(context.getTenantId(), sourceLayer, targetLayer).stream()
            .map(TraceabilityService::toResponse)
            .toList();
    }

    public List<TraceabilityMatrixEntryResponse> refreshMatrix() {
        SecurityContext context = securityContextProvider.getCurrentContext();
        securityKernel.authorizeAdministration(context, "traceability.refresh");
        String tenantId = context.getTenantId();
        Instant now = clock.instant();

        ArchitectureGraph graph = ArchitectureGraph.of(
            modelRepository.findElements(tenantId),
            modelRepository.findRelationships(tenantId));
        ExceptionOverlay overlay = ExceptionOverlay.of(exceptionRepository.findByTenant(tenantId, false), now);

        List<MissingLinkObservation> missingLinks = new ArrayList<>();
        for (ValidationRule rule : ruleRepository.findActive()) {
            missingLinks.addAll(ruleEvaluator.evaluate(rule, graph, overlay, now, () -> { }).missingLinks());
        }

        List<TraceabilityMatrixEntry> entries = TraceabilityMatrixBuilder.build(tenantId, graph, missingLinks, now);
        matrixRepository.replace(tenantId, entries);
        log.info("Traceability matrix refreshed: tenant={}, cells={}, missingLinks={}",
            tenantId, entries.size(), missingLinks.size());

        return entries.stream().map(TraceabilityService::toResponse).toList();
    }

    private static TraceabilityMatrixEntryResponse toResponse(TraceabilityMatrixEntry entry) {
        return TraceabilityMatrixEntryResponse.builder()
            .id(entry.getId())
            .tenantId(entry.getTenantId())
            .sourceLayer(entry.getSourceLayer())
            .targetLayer(entry.getTargetLayer())
            .sourceEntityType(entry.getSourceEntityType())
            .targetEntityType(entry.getTargetEntityType())
            .relationshipType(entry.getRelationshipType())
            .connectionCount(entry.getConnectionCount())
            .missingConnections(entry.getMissingConnections())
            .strengthScore(entry.getStrengthScore())
            .lastUpdated(entry.getLastUpdated())
            .build();
    }
}
