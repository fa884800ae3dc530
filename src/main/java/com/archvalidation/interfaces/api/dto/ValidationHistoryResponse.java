package com.archvalidation.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationHistoryResponse {
    private List<ValidationCycleResponse> cycles;
    private Long totalCycles;
    private Integer skip;
    private Integer limit;
    /**
     * Mean over all completed cycles of the tenant, 0.0 when there are none.
     */
    private Double averageMaturityScore;
    private Instant lastValidationDate;
}
