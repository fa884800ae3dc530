package com.archvalidation.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-layer scores of one completed cycle. Immutable once written.
 *
 * <p>The check and failure tallies are stored next to the scores so that a
 * scorecard can be recomputed from its own row.
 */
@Entity
@Table(name = "validation_scorecards", uniqueConstraints = {
    @UniqueConstraint(name = "uk_scorecard_cycle_layer", columnNames = {"validation_cycle_id", "layer"})
}, indexes = {
    @Index(name = "idx_scorecards_tenant_cycle", columnList = "tenant_id, validation_cycle_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ValidationScorecard {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "validation_cycle_id", nullable = false, updatable = false)
    private UUID validationCycleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "layer", nullable = false, updatable = false, length = 20)
    private ArchitectureLayer layer;

    @Column(name = "completeness_score", nullable = false, updatable = false)
    private double completenessScore;

    @Column(name = "traceability_score", nullable = false, updatable = false)
    private double traceabilityScore;

    @Column(name = "alignment_score", nullable = false, updatable = false)
    private double alignmentScore;

    @Column(name = "overall_score", nullable = false, updatable = false)
    private double overallScore;

    @Column(name = "completeness_checks", nullable = false, updatable = false)
    private int completenessChecks;

    @Column(name = "completeness_failures", nullable = false, updatable = false)
    private int completenessFailures;

    @Column(name = "traceability_checks", nullable = false, updatable = false)
    private int traceabilityChecks;

    @Column(name = "traceability_failures", nullable = false, updatable = false)
    private int traceabilityFailures;

    @Column(name = "alignment_checks", nullable = false, updatable = false)
    private int alignmentChecks;

    @Column(name = "alignment_failures", nullable = false, updatable = false)
    private int alignmentFailures;

    @Column(name = "critical_issues", nullable = false, updatable = false)
    private int criticalIssues;

    @Column(name = "high_issues", nullable = false, updatable = false)
    private int highIssues;

    @Column(name = "medium_issues", nullable = false, updatable = false)
    private int mediumIssues;

    @Column(name = "low_issues", nullable = false, updatable = false)
    private int lowIssues;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Builder
    private ValidationScorecard(
            String tenantId,
            UUID validationCycleId,
            ArchitectureLayer layer,
            double completenessScore,
            double traceabilityScore,
            double alignmentScore,
            double overallScore,
            int completenessChecks,
            int completenessFailures,
            int traceabilityChecks,
            int traceabilityFailures,
            int alignmentChecks,
            int alignmentFailures,
            int criticalIssues,
            int highIssues,
            int mediumIssues,
            int lowIssues,
            Instant createdAt) {

        requireUnitInterval("completeness", completenessScore);
        requireUnitInterval("traceability", traceabilityScore);
        requireUnitInterval("alignment", alignmentScore);
        requireUnitInterval("overall", overallScore);

        this.id = UUID.randomUUID();
        this.tenantId = tenantId;
        this.validationCycleId = validationCycleId;
        this.layer = layer;
        this.completenessScore = completenessScore;
        this.traceabilityScore = traceabilityScore;
        this.alignmentScore = alignmentScore;
        this.overallScore = overallScore;
        this.completenessChecks = completenessChecks;
        this.completenessFailures = completenessFailures;
        this.traceabilityChecks = traceabilityChecks;
        this.traceabilityFailures = traceabilityFailures;
        this.alignmentChecks = alignmentChecks;
        this.alignmentFailures = alignmentFailures;
        this.criticalIssues = criticalIssues;
        this.highIssues = highIssues;
        this.mediumIssues = mediumIssues;
        this.lowIssues = lowIssues;
        this.createdAt = createdAt;
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " score must be within [0,1]: " + value);
        }
    }
}
