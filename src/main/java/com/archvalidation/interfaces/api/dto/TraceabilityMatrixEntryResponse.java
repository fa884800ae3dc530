package com.archvalidation.interfaces.api.dto;

import com.archvalidation.domain.model.ArchitectureLayer;
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
public class TraceabilityMatrixEntryResponse {
    private UUID id;
    private String tenantId;
    private ArchitectureLayer sourceLayer;
    private ArchitectureLayer targetLayer;
    private String sourceEntityType;
    private String targetEntityType;
    private String relationshipType;
    private Integer connectionCount;
    private Integer missingConnections;
    private Double strengthScore;
    private Instant lastUpdated;
}
