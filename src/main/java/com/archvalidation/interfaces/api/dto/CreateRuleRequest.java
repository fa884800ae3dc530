package com.archvalidation.interfaces.api.dto;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.RuleType;
import com.archvalidation.domain.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to create a rule. {@code rule_logic} may be a JSON object or a
 * string holding one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRuleRequest {

    @NotBlank(message = "name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 2000)
    private String description;

    @NotNull(message = "rule_type is required")
    private RuleType ruleType;

    @NotNull(message = "scope is required")
    private ArchitectureLayer scope;

    @NotNull(message = "rule_logic is required")
    private JsonNode ruleLogic;

    private Severity severity;
}
