package com.archvalidation.domain.repository;

import com.archvalidation.domain.model.Severity;

import java.util.UUID;

/**
 * Filter and page for issue listings. Null filters match everything.
 */
public record IssueQuery(
        String tenantId,
        UUID validationCycleId,
        Severity severity,
        Boolean resolved,
        int skip,
        int limit) {

    public IssueQuery {
        if (tenantId == null) {
            throw new IllegalArgumentException("Tenant id is required");
        }
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }
}
