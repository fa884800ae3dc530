package com.archvalidation.interfaces.api;

import com.archvalidation.application.ArchitectureModelService;
import com.archvalidation.config.OpenApiConfiguration;
import com.archvalidation.interfaces.api.dto.ErrorResponse;
import com.archvalidation.interfaces.api.dto.ModelImportRequest;
import com.archvalidation.interfaces.api.dto.ModelSummaryResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the caller's architecture model.
 */
@RestController
@RequestMapping("/validation/model")
@RequiredArgsConstructor
@Tag(name = "Model", description = "Import and inspect the architecture model")
@SecurityRequirement(name = OpenApiConfiguration.BEARER_AUTH)
public class ArchitectureModelController {

    private final ArchitectureModelService modelService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Import elements and relationships",
        description = "Upserts elements by (type, id). Admin or Owner only."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Model imported"),
        @ApiResponse(
            responseCode = "422",
            description = "Unknown element type or dangling relationship",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ModelSummaryResponse importModel(@Valid @RequestBody ModelImportRequest request) {
        return modelService.importModel(request);
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Model summary", description = "Element counts per layer and relationship count")
    public ModelSummaryResponse getModelSummary() {
        return modelService.getSummary();
    }
}
