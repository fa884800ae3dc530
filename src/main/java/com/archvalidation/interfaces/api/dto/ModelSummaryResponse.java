package com.archvalidation.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelSummaryResponse {
    private String tenantId;
    private Long elementCount;
    private Long relationshipCount;
    /**
     * Element counts keyed by layer name.
     */
    private Map<String, Long> elementsByLayer;
    private Integer elementsImported;
    private Integer relationshipsImported;
}
