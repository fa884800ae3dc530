package com.archvalidation.interfaces.api;

import com.archvalidation.application.RuleService;
import com.archvalidation.config.OpenApiConfiguration;
import com.archvalidation.interfaces.api.dto.CreateRuleRequest;
import com.archvalidation.interfaces.api.dto.ErrorResponse;
import com.archvalidation.interfaces.api.dto.UpdateRuleRequest;
import com.archvalidation.interfaces.api.dto.ValidationRuleResponse;
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
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the global rule set.
 */
@RestController
@RequestMapping("/validation/rules")
@RequiredArgsConstructor
@Tag(name = "Rules", description = "Manage validation rules")
@SecurityRequirement(name = OpenApiConfiguration.BEARER_AUTH)
public class RuleController {

    private final RuleService ruleService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List rules", description = "All rules ordered by name, or only the active ones")
    public List<ValidationRuleResponse> listRules(
            @RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly) {
        return ruleService.listRules(activeOnly);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create a rule", description = "Admin or Owner only")
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Rule created",
            content = @Content(schema = @Schema(implementation = ValidationRuleResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "A rule with this name exists",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "422",
            description = "Invalid rule or rule logic",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<ValidationRuleResponse> createRule(@Valid @RequestBody CreateRuleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ruleService.createRule(request));
    }

    @PatchMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Toggle or revise a rule", description = "Admin or Owner only")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Rule updated"),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown rule",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ValidationRuleResponse updateRule(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateRuleRequest request) {
        return ruleService.updateRule(id, request);
    }
}
