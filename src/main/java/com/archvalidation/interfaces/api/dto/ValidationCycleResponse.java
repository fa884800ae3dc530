package com.archvalidation.interfaces.api.dto;

import com.archvalidation.domain.model.ExecutionStatus;
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
public class ValidationCycleResponse {
    private UUID id;
    private String tenantId;
    private String triggeredBy;
    private String ruleSetId;
    private Instant startTime;
    private Instant endTime;
    private ExecutionStatus executionStatus;
    private Integer totalIssuesFound;
    private Integer suppressedIssues;
    private Integer rulesEvaluated;
    private Integer elementsChecked;
    private Double maturityScore;
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;
}
