package com.archvalidation.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Request to accept a known gap. The tenant is taken from the caller's token.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateExceptionRequest {

    @NotBlank(message = "entity_type is required")
    @Size(max = 100)
    private String entityType;

    @NotBlank(message = "entity_id is required")
    @Size(max = 255)
    private String entityId;

    /**
     * Restrict the exception to one rule; null covers all rules.
     */
    private UUID ruleId;

    @NotBlank(message = "reason is required")
    @Size(max = 2000)
    private String reason;

    private Instant expiresAt;
}
