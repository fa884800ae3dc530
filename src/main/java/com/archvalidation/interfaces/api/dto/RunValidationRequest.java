package com.archvalidation.interfaces.api.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to start a validation cycle. The body is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunValidationRequest {

    /**
     * Free-form label stored on the cycle.
     */
    @Size(max = 100, message = "rule_set_id must be at most 100 characters")
    private String ruleSetId;
}
