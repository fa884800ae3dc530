package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.IssueType;
import com.archvalidation.domain.model.Severity;
import lombok.Builder;

import java.util.Map;
import java.util.UUID;

/**
 * An issue found by the evaluator that survived the exception overlay and is
 * waiting to be persisted.
 */
@Builder
public record IssueCandidate(
        UUID ruleId,
        String entityType,
        String entityId,
        ArchitectureLayer layer,
        IssueType issueType,
        Severity severity,
        String description,
        String recommendedFix,
        Map<String, Object> metadata) {
}
