package com.archvalidation.interfaces.api.dto;

import com.archvalidation.domain.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial rule update. Absent fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRuleRequest {
    private Boolean isActive;

    @Size(max = 2000)
    private String description;

    private JsonNode ruleLogic;

    private Severity severity;
}
