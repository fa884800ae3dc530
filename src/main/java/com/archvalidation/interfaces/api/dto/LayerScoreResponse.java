package com.archvalidation.interfaces.api.dto;

import com.archvalidation.domain.model.ArchitectureLayer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayerScoreResponse {
    private UUID id;
    private String tenantId;
    private UUID validationCycleId;
    private ArchitectureLayer layer;
    private Double completenessScore;
    private Double traceabilityScore;
    private Double alignmentScore;
    private Double overallScore;
    private Integer completenessChecks;
    private Integer traceabilityChecks;
    private Integer alignmentChecks;
    private Integer issuesCount;
    private Integer criticalIssues;
    private Integer highIssues;
    private Integer mediumIssues;
    private Integer lowIssues;
    private Instant createdAt;
}
