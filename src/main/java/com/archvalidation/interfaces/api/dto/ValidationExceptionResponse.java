package com.archvalidation.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationExceptionResponse {
    private UUID id;
    private String tenantId;
    private String entityType;
    private String entityId;
    private UUID ruleId;
    private String reason;
    private String createdBy;
    private Instant createdAt;
    private Instant expiresAt;
    private Boolean isActive;
    /**
     * Active and not expired at response time.
     */
    private Boolean isEffective;
}
