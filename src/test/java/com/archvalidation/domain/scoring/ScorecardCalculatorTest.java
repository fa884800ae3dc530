package com.archvalidation.domain.scoring;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.IssueType;
import com.archvalidation.domain.model.RuleType;
import com.archvalidation.domain.model.Severity;
import com.archvalidation.domain.rules.IssueCandidate;
import com.archvalidation.domain.rules.RuleResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ScorecardCalculatorTest {

    private static RuleResult result(RuleType type, ArchitectureLayer scope, int checks, int failures, List<IssueCandidate> issues) {
        return new RuleResult(UUID.randomUUID(), type, scope, checks, failures, 0, issues, List.of(), true);
    }

    private static IssueCandidate issue(ArchitectureLayer layer, Severity severity) {
        return IssueCandidate.builder()
            .entityType("goal")
            .entityId("G1")
            .layer(layer)
            .issueType(IssueType.MISSING_LINK)
            .severity(severity)
            .description("gap")
            .build();
    }

    private static LayerScore scoreOf(List<LayerScore> scores, ArchitectureLayer layer) {
        return scores.stream().filter(score -> score.layer() == layer).findFirst().orElseThrow();
    }

    @Test
    void emptyTallyScoresOneEverywhere() {
        List<LayerScore> scores = ScorecardCalculator.layerScores(new CheckTally());

        assertEquals(5, scores.size());
        scores.forEach(score -> assertEquals(1.0, score.overallScore()));
        assertEquals(1.0, ScorecardCalculator.maturity(scores));
    }

    @Test
    void scoresArePassedChecksOverChecksPerLayerAndType() {
        CheckTally tally = new CheckTally();
        tally.add(result(RuleType.TRACEABILITY, ArchitectureLayer.MOTIVATION, 4, 1,
            List.of(issue(ArchitectureLayer.MOTIVATION, Severity.HIGH))));
        tally.add(result(RuleType.TRACEABILITY, ArchitectureLayer.MOTIVATION, 4, 3, List.of()));
        tally.add(result(RuleType.COMPLETENESS, ArchitectureLayer.MOTIVATION, 2, 0, List.of()));

        LayerScore motivation = scoreOf(ScorecardCalculator.layerScores(tally), ArchitectureLayer.MOTIVATION);

        assertEquals(0.5, motivation.traceabilityScore(), 1e-9);
        assertEquals(1.0, motivation.completenessScore(), 1e-9);
        assertEquals(1.0, motivation.alignmentScore(), 1e-9);
        assertEquals(2.5 / 3.0, motivation.overallScore(), 1e-9);
        assertEquals(1, motivation.severities().high());
        assertEquals(new CheckCounts(8, 4), motivation.traceability());
    }

    @Test
    void maturityIsMeanOfLayerOverallScores() {
        CheckTally tally = new CheckTally();
        tally.add(result(RuleType.ALIGNMENT, ArchitectureLayer.BUSINESS, 1, 1, List.of()));

        List<LayerScore> scores = ScorecardCalculator.layerScores(tally);

        double expected = (4.0 + 2.0 / 3.0) / 5.0;
        assertEquals(expected, ScorecardCalculator.maturity(scores), 1e-9);
        assertEquals(expected, ScorecardCalculator.maturityOfOverallScores(
            scores.stream().map(LayerScore::overallScore).toList()), 1e-9);
    }

    @Test
    void overallIsDeterministicMeanOfDimensions() {
        assertEquals(0.5, ScorecardCalculator.overall(0.0, 0.5, 1.0), 1e-9);
        assertEquals(ScorecardCalculator.overall(0.2, 0.4, 0.9), ScorecardCalculator.overall(0.2, 0.4, 0.9));
    }

    @Test
    void tallyCountsRulesAndSuppressions() {
        CheckTally tally = new CheckTally();
        tally.add(new RuleResult(UUID.randomUUID(), RuleType.COMPLETENESS, ArchitectureLayer.TECHNOLOGY,
            3, 0, 2, List.of(), List.of(), true));
        tally.add(result(RuleType.COMPLETENESS, ArchitectureLayer.TECHNOLOGY, 0, 0, List.of()));

        assertEquals(2, tally.rulesEvaluated());
        assertEquals(2, tally.suppressed());
        assertEquals(new CheckCounts(3, 0), tally.counts(ArchitectureLayer.TECHNOLOGY, RuleType.COMPLETENESS));
    }

    @Test
    void rejectsMoreFailuresThanChecks() {
        assertThrows(IllegalArgumentException.class, () -> new CheckCounts(1, 2));
    }
}
