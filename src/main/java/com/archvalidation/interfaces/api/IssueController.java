package com.archvalidation.interfaces.api;

import com.archvalidation.application.IssueService;
import com.archvalidation.config.OpenApiConfiguration;
import com.archvalidation.domain.model.Severity;
import com.archvalidation.interfaces.api.dto.ErrorResponse;
import com.archvalidation.interfaces.api.dto.IssuesListResponse;
import com.archvalidation.interfaces.api.dto.ValidationIssueResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for validation issues of the caller's tenant.
 */
@RestController
@RequestMapping("/validation/issues")
@RequiredArgsConstructor
@Validated
@Tag(name = "Issues", description = "Browse and resolve validation issues")
@SecurityRequirement(name = OpenApiConfiguration.BEARER_AUTH)
public class IssueController {

    private final IssueService issueService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "List issues",
        description = "Newest first. Severity counts cover all of the tenant's issues."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Issue page"),
        @ApiResponse(
            responseCode = "422",
            description = "Invalid paging or filter parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public IssuesListResponse listIssues(
            @RequestParam(name = "skip", defaultValue = "0") @Min(0) int skip,
            @RequestParam(name = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(name = "validation_cycle_id", required = false) UUID validationCycleId,
            @RequestParam(name = "severity", required = false) Severity severity,
            @RequestParam(name = "resolved", required = false) Boolean resolved) {

        return issueService.listIssues(skip, limit, validationCycleId, severity, resolved);
    }

    @PostMapping(value = "/{id}/resolve", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Resolve an issue", description = "Idempotent; a resolved issue keeps its first resolution")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Issue resolved"),
        @ApiResponse(
            responseCode = "403",
            description = "Issue belongs to another tenant",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown issue",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ValidationIssueResponse resolveIssue(@PathVariable("id") UUID id) {
        return issueService.resolveIssue(id);
    }
}
