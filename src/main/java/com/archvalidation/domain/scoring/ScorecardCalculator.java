package com.archvalidation.domain.scoring;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.RuleType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Turns check tallies into layer scores and a maturity score.
 *
 * <p>For a layer and rule type the score is passed checks over checks, or 1.0
 * without checks. A layer's overall score is the mean of its three dimension
 * scores and the maturity score is the mean over all five layers, so a tenant
 * with nothing to check scores 1.0. Pure and deterministic.
 */
public final class ScorecardCalculator {

    private ScorecardCalculator() {
    }

    public static List<LayerScore> layerScores(CheckTally tally) {
        List<LayerScore> scores = new ArrayList<>();
        for (ArchitectureLayer layer : ArchitectureLayer.values()) {
            scores.add(new LayerScore(
                layer,
                tally.counts(layer, RuleType.COMPLETENESS),
                tally.counts(layer, RuleType.TRACEABILITY),
                tally.counts(layer, RuleType.ALIGNMENT),
                tally.severities(layer)));
        }
        return scores;
    }

    public static double overall(double completeness, double traceability, double alignment) {
        return (completeness + traceability + alignment) / 3.0;
    }

    public static double maturity(Collection<LayerScore> layerScores) {
        if (layerScores.isEmpty()) {
            return 1.0;
        }
        double sum = 0.0;
        for (LayerScore score : layerScores) {
            sum += score.overallScore();
        }
        return clamp(sum / layerScores.size());
    }

    /**
     * Recompute a maturity score from stored overall scores.
     */
    public static double maturityOfOverallScores(Collection<Double> overallScores) {
        if (overallScores.isEmpty()) {
            return 1.0;
        }
        double sum = 0.0;
        for (double score : overallScores) {
            sum += score;
        }
        return clamp(sum / overallScores.size());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
