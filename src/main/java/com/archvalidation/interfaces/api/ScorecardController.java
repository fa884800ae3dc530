package com.archvalidation.interfaces.api;

import com.archvalidation.application.ScorecardService;
import com.archvalidation.application.TraceabilityService;
import com.archvalidation.config.OpenApiConfiguration;
import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.interfaces.api.dto.ErrorResponse;
import com.archvalidation.interfaces.api.dto.ScorecardResponse;
import com.archvalidation.interfaces.api.dto.TraceabilityMatrixEntryResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for scores: per-layer scorecards and the traceability matrix.
 */
@RestController
@RequestMapping("/validation")
@RequiredArgsConstructor
@Tag(name = "Scores", description = "Scorecards and traceability matrix")
@SecurityRequirement(name = OpenApiConfiguration.BEARER_AUTH)
public class ScorecardController {

    private final ScorecardService scorecardService;
    private final TraceabilityService traceabilityService;

    @GetMapping(value = "/scorecard", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Get a scorecard",
        description = "Scorecard of the given completed cycle, or of the latest completed cycle"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Scorecard"),
        @ApiResponse(
            responseCode = "404",
            description = "No such completed cycle",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ScorecardResponse getScorecard(
            @RequestParam(name = "validation_cycle_id", required = false) UUID validationCycleId) {
        return scorecardService.getScorecard(validationCycleId);
    }

    @GetMapping(value = "/traceability-matrix", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get the traceability matrix", description = "Optionally restricted to a source and/or target layer")
    public List<TraceabilityMatrixEntryResponse> getTraceabilityMatrix(
            @RequestParam(name = "source_layer", required = false) ArchitectureLayer sourceLayer,
            @RequestParam(name = "target_layer", required = false) ArchitectureLayer targetLayer) {
        return traceabilityService.getMatrix(sourceLayer, targetLayer);
    }

    @PostMapping(value = "/traceability-matrix/refresh", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Rebuild the traceability matrix", description = "Admin or Owner only")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Rebuilt matrix"),
        @ApiResponse(
            responseCode = "403",
            description = "Admin or Owner role required",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public List<TraceabilityMatrixEntryResponse> refreshTraceabilityMatrix() {
        return traceabilityService.refreshMatrix();
    }
}
