package com.archvalidation.application;

import com.archvalidation.application.exception.ResourceNotFoundException;
import com.archvalidation.domain.model.ExecutionStatus;
import com.archvalidation.domain.model.ValidationCycle;
import com.archvalidation.domain.model.ValidationScorecard;
import com.archvalidation.domain.repository.ValidationCycleRepository;
import com.archvalidation.domain.repository.ValidationScorecardRepository;
import com.archvalidation.domain.scoring.ScorecardCalculator;
import com.archvalidation.infrastructure.security.SecurityContext;
import com.archvalidation.interfaces.api.dto.LayerScoreResponse;
import com.archvalidation.interfaces.api.dto.ScorecardResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the per-layer scorecards.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class ScorecardService {

    private final ValidationCycleRepository cycleRepository;
    private final ValidationScorecardRepository scorecardRepository;
    private final SecurityContextProvider securityContextProvider;

    /**
     * Scorecard of a completed cycle of the caller's tenant.
     *
     * @param cycleId Cycle to report on, or null for the latest completed cycle
     * @throws ResourceNotFoundException if there is no such completed cycle
     */
    public ScorecardResponse getScorecard(UUID cycleId) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        String tenantId = context.getTenantId();

        ValidationCycle cycle = cycleId == null
            ? cycleRepository.findLatestCompleted(tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("No completed validation cycle for tenant"))
            : cycleRepository.findByIdAndTenant(cycleId, tenantId)
                .filter(found -> found.getExecutionStatus() == ExecutionStatus.COMPLETED)
                .orElseThrow(() -> ResourceNotFoundException.of("Completed validation cycle", cycleId));

        List<ValidationScorecard> scorecards = scorecardRepository.findByCycle(tenantId, cycle.getId());
        List<LayerScoreResponse> layerScores = scorecards.stream()
            .map(ScorecardService::toResponse)
            .toList();

        double average = ScorecardCalculator.maturityOfOverallScores(
            scorecards.stream().map(ValidationScorecard::getOverallScore).toList());
        double maturity = cycle.getMaturityScore() != null ? cycle.getMaturityScore() : average;

        return ScorecardResponse.builder()
            .tenantId(tenantId)
            .validationCycleId(cycle.getId())
            .overallMaturityScore(maturity)
            .layerScores(layerScores)
            .summary(ScorecardResponse.Summary.builder()
                .totalLayers(scorecards.size())
                .averageScore(average)
                .bestLayer(scorecards.stream()
                    .max(Comparator.comparingDouble(ValidationScorecard::getOverallScore))
                    .map(ValidationScorecard::getLayer)
                    .orElse(null))
                .worstLayer(scorecards.stream()
                    .min(Comparator.comparingDouble(ValidationScorecard::getOverallScore))
                    .map(ValidationScorecard::getLayer)
                    .orElse(null))
                .build())
            .build();
    }

    private static LayerScoreResponse toResponse(ValidationScorecard scorecard) {
        return LayerScoreResponse.builder()
            .id(scorecard.getId())
            .tenantId(scorecard.getTenantId())
            .validationCycleId(scorecard.getValidationCycleId())
            .layer(scorecard.getLayer())
            .completenessScore(scorecard.getCompletenessScore())
            .traceabilityScore(scorecard.getTraceabilityScore())
            .alignmentScore(scorecard.getAlignmentScore())
            .overallScore(scorecard.getOverallScore())
            .completenessChecks(scorecard.getCompletenessChecks())
            .traceabilityChecks(scorecard.getTraceabilityChecks())
            .alignmentChecks(scorecard.getAlignmentChecks())
            .issuesCount(scorecard.getCriticalIssues() + scorecard.getHighIssues()
                + scorecard.getMediumIssues() + scorecard.getLowIssues())
            .criticalIssues(scorecard.getCriticalIssues())
            .highIssues(scorecard.getHighIssues())
            .mediumIssues(scorecard.getMediumIssues())
            .lowIssues(scorecard.getLowIssues())
            .createdAt(scorecard.getCreatedAt())
            .build();
    }
}
