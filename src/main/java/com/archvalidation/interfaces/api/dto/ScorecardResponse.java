package com.archvalidation.interfaces.api.dto;

import com.archvalidation.domain.model.ArchitectureLayer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScorecardResponse {
    private String tenantId;
    private UUID validationCycleId;
    private Double overallMaturityScore;
    private List<LayerScoreResponse> layerScores;
    private Summary summary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private Integer totalLayers;
        private Double averageScore;
        private ArchitectureLayer bestLayer;
        private ArchitectureLayer worstLayer;
    }
}
