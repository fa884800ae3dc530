package com.archvalidation.application;

import com.archvalidation.application.exception.InvalidRequestException;
import com.archvalidation.application.exception.ResourceNotFoundException;
import com.archvalidation.config.ValidationProperties;
import com.archvalidation.domain.model.Severity;
import com.archvalidation.domain.model.ValidationIssue;
import com.archvalidation.domain.repository.IssueQuery;
import com.archvalidation.domain.repository.ValidationIssueRepository;
import com.archvalidation.infrastructure.audit.AuditService;
import com.archvalidation.infrastructure.security.SecurityContext;
import com.archvalidation.infrastructure.security.SecurityKernel;
import com.archvalidation.interfaces.api.dto.IssuesListResponse;
import com.archvalidation.interfaces.api.dto.ValidationIssueResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Application service for listing and resolving validation issues.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class IssueService {

    private final ValidationIssueRepository issueRepository;
    private final SecurityKernel securityKernel;
    private final SecurityContextProvider securityContextProvider;
    private final AuditService auditService;
    private final ValidationProperties properties;
    private final Clock clock;

    /**
     * Page through the caller's issues, newest first.
     *
     * @throws InvalidRequestException if skip or limit are out of range
     */
    @Transactional(readOnly = true)
    public IssuesListResponse listIssues(
            int skip,
            int limit,
            UUID validationCycleId,
            Severity severity,
            Boolean resolved) {
        SecurityContext context = securityContextProvider.getCurrentContext();

        int maxPageSize = properties.getIssues().getMaxPageSize();
        if (skip < 0 || limit < 1 || limit > maxPageSize) {
            throw new InvalidRequestException(
                "skip must not be negative and limit must be between 1 and " + maxPageSize);
        }
        IssueQuery query = new IssueQuery(context.getTenantId(), validationCycleId, severity, resolved, skip, limit);

        List<ValidationIssueResponse> issues = issueRepository.find(query).stream()
            .map(IssueService::toResponse)
            .toList();
        Map<Severity, Long> severityCounts = issueRepository.countBySeverity(context.getTenantId());

        return IssuesListResponse.builder()
            .issues(issues)
            .totalCount(issueRepository.count(query))
            .skip(skip)
            .limit(limit)
            .criticalCount(severityCounts.getOrDefault(Severity.CRITICAL, 0L))
            .highCount(severityCounts.getOrDefault(Severity.HIGH, 0L))
            .mediumCount(severityCounts.getOrDefault(Severity.MEDIUM, 0L))
            .lowCount(severityCounts.getOrDefault(Severity.LOW, 0L))
            .build();
    }

    /**
     * Mark an issue resolved. Resolving an already resolved issue changes nothing.
     */
    public ValidationIssueResponse resolveIssue(UUID issueId) {
        SecurityContext context = securityContextProvider.getCurrentContext();

        ValidationIssue issue = issueRepository.findById(issueId)
            .orElseThrow(() -> ResourceNotFoundException.of("Validation issue", issueId));
        securityKernel.authorizeTenantAccess(context, issue.getTenantId(), "issue.resolve");

        if (issue.resolve(context.getPrincipalId(), clock.instant())) {
            issue = issueRepository.save(issue);
            auditService.record(AuditService.ISSUE_RESOLVED, issue.getTenantId(), issueId.toString(),
                context.getPrincipalId(), null);
            log.info("Issue resolved: id={}, tenant={}, by={}", issueId, issue.getTenantId(), context.getPrincipalId());
        } else {
            log.debug("Issue already resolved: id={}", issueId);
        }
        return toResponse(issue);
    }

    static ValidationIssueResponse toResponse(ValidationIssue issue) {
        return ValidationIssueResponse.builder()
            .id(issue.getId())
            .tenantId(issue.getTenantId())
            .validationCycleId(issue.getValidationCycleId())
            .ruleId(issue.getRuleId())
            .entityType(issue.getEntityType())
            .entityId(issue.getEntityId())
            .layer(issue.getLayer())
            .issueType(issue.getIssueType())
            .severity(issue.getSeverity())
            .description(issue.getDescription())
            .recommendedFix(issue.getRecommendedFix())
            .metadata(issue.getMetadata())
            .detectedAt(issue.getDetectedAt())
            .isResolved(issue.isResolved())
            .resolvedAt(issue.getResolvedAt())
            .resolvedBy(issue.getResolvedBy())
            .build();
    }
}
