package com.archvalidation.interfaces.api;

import com.archvalidation.application.ValidationCycleService;
import com.archvalidation.config.OpenApiConfiguration;
import com.archvalidation.interfaces.api.dto.ErrorResponse;
import com.archvalidation.interfaces.api.dto.RunValidationRequest;
import com.archvalidation.interfaces.api.dto.ValidationCycleResponse;
import com.archvalidation.interfaces.api.dto.ValidationHistoryResponse;
import com.archvalidation.interfaces.api.dto.ValidationRunResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for validation cycles.
 *
 * Provides endpoints for:
 * - Starting a cycle for the caller's tenant
 * - Polling and cancelling a cycle
 * - Listing the tenant's cycle history
 */
@RestController
@RequestMapping("/validation")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Validation cycles", description = "Run and track validation cycles")
@SecurityRequirement(name = OpenApiConfiguration.BEARER_AUTH)
public class ValidationCycleController {

    private final ValidationCycleService cycleService;

    @PostMapping(value = "/run", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Start a validation cycle",
        description = "Evaluates all active rules against the caller's tenant. Admin or Owner only."
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "202",
            description = "Cycle accepted",
            content = @Content(schema = @Schema(implementation = ValidationRunResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Admin or Owner role required",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "A cycle is already running for the tenant",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<ValidationRunResponse> runValidation(
            @Valid @RequestBody(required = false) RunValidationRequest request) {

        ValidationRunResponse response = cycleService.startCycle(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping(value = "/cycles/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get a validation cycle")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Cycle found"),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown cycle",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ValidationCycleResponse getCycle(@PathVariable("id") UUID id) {
        return cycleService.getCycle(id);
    }

    @PostMapping(value = "/cycles/{id}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Cancel a running cycle",
        description = "The cycle stops at its next checkpoint and ends as cancelled. Admin or Owner only."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Cancellation requested"),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown cycle",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Cycle already finished",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ValidationCycleResponse cancelCycle(@PathVariable("id") UUID id) {
        log.info("Cancel requested for cycle {}", id);
        return cycleService.cancelCycle(id);
    }

    @GetMapping(value = "/history", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Validation history",
        description = "Cycles of the caller's tenant, newest first, with the average maturity score"
    )
    public ValidationHistoryResponse getHistory(
            @RequestParam(name = "skip", defaultValue = "0") @Min(0) int skip,
            @RequestParam(name = "limit", defaultValue = "50") @Min(1) @Max(100) int limit) {

        return cycleService.getHistory(skip, limit);
    }
}
