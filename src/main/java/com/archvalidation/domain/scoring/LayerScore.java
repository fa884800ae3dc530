package com.archvalidation.domain.scoring;

import com.archvalidation.domain.model.ArchitectureLayer;

/**
 * Scores of one layer. All values lie in [0,1].
 */
public record LayerScore(
        ArchitectureLayer layer,
        CheckCounts completeness,
        CheckCounts traceability,
        CheckCounts alignment,
        SeverityCounts severities) {

    public double completenessScore() {
        return completeness.score();
    }

    public double traceabilityScore() {
        return traceability.score();
    }

    public double alignmentScore() {
        return alignment.score();
    }

    /**
     * Unweighted mean of the three dimension scores.
     */
    public double overallScore() {
        return ScorecardCalculator.overall(completenessScore(), traceabilityScore(), alignmentScore());
    }
}
