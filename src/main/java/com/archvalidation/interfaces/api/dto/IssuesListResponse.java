package com.archvalidation.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A page of issues. {@code total_count} counts the issues matching the
 * filters; the severity counts cover all of the tenant's issues.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssuesListResponse {
    private List<ValidationIssueResponse> issues;
    private Long totalCount;
    private Integer skip;
    private Integer limit;
    private Long criticalCount;
    private Long highCount;
    private Long mediumCount;
    private Long lowCount;
}
