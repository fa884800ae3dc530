package com.archvalidation.interfaces.api;

import com.archvalidation.application.ExceptionService;
import com.archvalidation.config.OpenApiConfiguration;
import com.archvalidation.interfaces.api.dto.CreateExceptionRequest;
import com.archvalidation.interfaces.api.dto.ErrorResponse;
import com.archvalidation.interfaces.api.dto.ValidationExceptionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for validation exceptions: accepted gaps that cycles do not report.
 */
@RestController
@RequestMapping("/validation/exceptions")
@RequiredArgsConstructor
@Tag(name = "Exceptions", description = "Suppress known modeling gaps")
@SecurityRequirement(name = OpenApiConfiguration.BEARER_AUTH)
public class ExceptionController {

    private final ExceptionService exceptionService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create an exception", description = "Admin or Owner only")
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Exception created",
            content = @Content(schema = @Schema(implementation = ValidationExceptionResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown rule",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "422",
            description = "Invalid request, e.g. expiry in the past",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<ValidationExceptionResponse> createException(
            @Valid @RequestBody CreateExceptionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(exceptionService.createException(request));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List exceptions of the caller's tenant")
    public List<ValidationExceptionResponse> listExceptions(
            @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return exceptionService.listExceptions(includeInactive);
    }

    @PostMapping(value = "/{id}/deactivate", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Deactivate an exception", description = "Admin or Owner only")
    public ValidationExceptionResponse deactivateException(@PathVariable("id") UUID id) {
        return exceptionService.deactivateException(id);
    }
}
