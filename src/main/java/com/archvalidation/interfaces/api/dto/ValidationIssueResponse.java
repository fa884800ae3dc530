package com.archvalidation.interfaces.api.dto;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.IssueType;
import com.archvalidation.domain.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationIssueResponse {
    private UUID id;
    private String tenantId;
    private UUID validationCycleId;
    private UUID ruleId;
    private String entityType;
    private String entityId;
    private ArchitectureLayer layer;
    private IssueType issueType;
    private Severity severity;
    private String description;
    private String recommendedFix;
    private Map<String, Object> metadata;
    private Instant detectedAt;
    private Boolean isResolved;
    private Instant resolvedAt;
    private String resolvedBy;
}
