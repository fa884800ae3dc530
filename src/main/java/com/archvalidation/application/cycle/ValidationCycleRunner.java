package com.archvalidation.application.cycle;

import com.archvalidation.application.exception.ResourceNotFoundException;
import com.archvalidation.config.PerformanceConfiguration.ValidationMetrics;
import com.archvalidation.domain.model.ValidationCycle;
import com.archvalidation.domain.model.ValidationCycle.CycleStatistics;
import com.archvalidation.domain.model.ValidationIssue;
import com.archvalidation.domain.model.ValidationRule;
import com.archvalidation.domain.model.ValidationScorecard;
import com.archvalidation.domain.repository.ArchitectureModelRepository;
import com.archvalidation.domain.repository.TraceabilityMatrixRepository;
import com.archvalidation.domain.repository.ValidationCycleRepository;
import com.archvalidation.domain.repository.ValidationExceptionRepository;
import com.archvalidation.domain.repository.ValidationIssueRepository;
import com.archvalidation.domain.repository.ValidationRuleRepository;
import com.archvalidation.domain.repository.ValidationScorecardRepository;
import com.archvalidation.domain.rules.ArchitectureGraph;
import com.archvalidation.domain.rules.ExceptionOverlay;
import com.archvalidation.domain.rules.IssueCandidate;
import com.archvalidation.domain.rules.RuleEvaluator;
import com.archvalidation.domain.scoring.CheckTally;
import com.archvalidation.domain.scoring.LayerScore;
import com.archvalidation.domain.scoring.ScorecardCalculator;
import com.archvalidation.domain.scoring.TraceabilityMatrixBuilder;
import com.archvalidation.infrastructure.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Evaluates all active rules against one tenant and stores the outcome.
 *
 * <p>Everything a cycle writes (issues, scorecards, matrix, final cycle
 * state) happens in one transaction. If the run is cancelled, times out or
 * fails, nothing of it is kept and the caller records the outcome separately.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ValidationCycleRunner {

    private final ValidationCycleRepository cycleRepository;
    private final ValidationRuleRepository ruleRepository;
    private final ValidationIssueRepository issueRepository;
    private final ValidationExceptionRepository exceptionRepository;
    private final ValidationScorecardRepository scorecardRepository;
    private final TraceabilityMatrixRepository matrixRepository;
    private final ArchitectureModelRepository modelRepository;
    private final RuleEvaluator ruleEvaluator;
    private final AuditService auditService;
    private final ValidationMetrics metrics;
    private final Clock clock;

    /**
     * Run a registered cycle to completion.
     *
     * @param cycleId Cycle in the RUNNING state
     * @param token Cancellation and timeout signal, checked between checks
     * @return The completed cycle
     * @throws CycleCancelledException if cancellation was requested
     * @throws CycleTimeoutException if the deadline passed
     */
    @Transactional
    public ValidationCycle run(UUID cycleId, CancellationToken token) {
        ValidationCycle cycle = cycleRepository.findById(cycleId)
            .orElseThrow(() -> ResourceNotFoundException.of("Validation cycle", cycleId));
        String tenantId = cycle.getTenantId();
        Instant evaluatedAt = clock.instant();

        ArchitectureGraph graph = ArchitectureGraph.of(
            modelRepository.findElements(tenantId),
            modelRepository.findRelationships(tenantId));
        ExceptionOverlay overlay = ExceptionOverlay.of(
            exceptionRepository.findByTenant(tenantId, false), evaluatedAt);
        List<ValidationRule> rules = ruleRepository.findActive();

        log.info("Evaluating cycle: cycle={}, tenant={}, rules={}, elements={}, exceptions={}",
            cycleId, tenantId, rules.size(), graph.size(), overlay.size());

        CheckTally tally = new CheckTally();
        for (ValidationRule rule : rules) {
            token.checkpoint();
            tally.add(ruleEvaluator.evaluate(rule, graph, overlay, evaluatedAt, token::checkpoint));
        }
        token.checkpoint();

        Instant completedAt = clock.instant();

        List<ValidationIssue> issues = tally.issues().stream()
            .map(candidate -> toIssue(candidate, tenantId, cycleId, evaluatedAt))
            .toList();
        issueRepository.saveAll(issues);

        List<LayerScore> layerScores = ScorecardCalculator.layerScores(tally);
        scorecardRepository.saveAll(layerScores.stream()
            .map(score -> toScorecard(score, tenantId, cycleId, completedAt))
            .toList());

        matrixRepository.replace(tenantId,
            TraceabilityMatrixBuilder.build(tenantId, graph, tally.missingLinks(), completedAt));

        double maturity = ScorecardCalculator.maturity(layerScores);
        cycle.complete(
            new CycleStatistics(issues.size(), tally.suppressed(), tally.rulesEvaluated(), graph.size()),
            maturity,
            completedAt);
        ValidationCycle saved = cycleRepository.save(cycle);

        auditService.record(AuditService.CYCLE_COMPLETED, tenantId, cycleId.toString(), cycle.getTriggeredBy(),
            String.format("issues=%d suppressed=%d maturity=%.4f", issues.size(), tally.suppressed(), maturity));
        metrics.recordCycleCompleted(issues.size(), tally.suppressed());

        log.info("Validation cycle completed: cycle={}, tenant={}, issues={}, suppressed={}, maturity={}",
            cycleId, tenantId, issues.size(), tally.suppressed(), maturity);
        return saved;
    }

    private static ValidationIssue toIssue(IssueCandidate candidate, String tenantId, UUID cycleId, Instant detectedAt) {
        return ValidationIssue.builder()
            .tenantId(tenantId)
            .validationCycleId(cycleId)
            .ruleId(candidate.ruleId())
            .entityType(candidate.entityType())
            .entityId(candidate.entityId())
            .layer(candidate.layer())
            .issueType(candidate.issueType())
            .severity(candidate.severity())
            .description(candidate.description())
            .recommendedFix(candidate.recommendedFix())
            .metadata(candidate.metadata())
            .detectedAt(detectedAt)
            .build();
    }

    private static ValidationScorecard toScorecard(LayerScore score, String tenantId, UUID cycleId, Instant createdAt) {
        return ValidationScorecard.builder()
            .tenantId(tenantId)
            .validationCycleId(cycleId)
            .layer(score.layer())
            .completenessScore(score.completenessScore())
            .traceabilityScore(score.traceabilityScore())
            .alignmentScore(score.alignmentScore())
            .overallScore(score.overallScore())
            .completenessChecks(score.completeness().checks())
            .completenessFailures(score.completeness().failures())
            .traceabilityChecks(score.traceability().checks())
            .traceabilityFailures(score.traceability().failures())
            .alignmentChecks(score.alignment().checks())
            .alignmentFailures(score.alignment().failures())
            .criticalIssues(score.severities().critical())
            .highIssues(score.severities().high())
            .mediumIssues(score.severities().medium())
            .lowIssues(score.severities().low())
            .createdAt(createdAt)
            .build();
    }
}
