package com.archvalidation.interfaces.api.dto;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.RuleType;
import com.archvalidation.domain.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
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
public class ValidationRuleResponse {
    private UUID id;
    private String name;
    private String description;
    private RuleType ruleType;
    private ArchitectureLayer scope;
    private JsonNode ruleLogic;
    private Boolean isActive;
    private Severity severity;
    private Instant createdAt;
    private Instant updatedAt;
}
