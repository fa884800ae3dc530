package com.archvalidation.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Service-wide aggregate counters. Carries no tenant data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsResponse {
    private Long totalValidations;
    private Long completedValidations;
    private Long failedValidations;
    private Long cancelledValidations;
    private Long runningValidations;
    private Long totalIssues;
    private Long unresolvedIssues;
    private Long totalRules;
    private Long activeRules;
    private Long activeExceptions;
    private Double averageMaturityScore;
    private Instant timestamp;
}
