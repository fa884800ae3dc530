package com.archvalidation.interfaces.api.dto;

import com.archvalidation.domain.model.ArchitectureLayer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Elements and relationships to load into the caller's tenant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelImportRequest {

    @Valid
    @NotNull
    @Builder.Default
    private List<ElementPayload> elements = new ArrayList<>();

    @Valid
    @NotNull
    @Builder.Default
    private List<RelationshipPayload> relationships = new ArrayList<>();

    /**
     * Clear the tenant's model before importing.
     */
    private boolean replace;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ElementPayload {
        @NotBlank(message = "element id is required")
        @Size(max = 255)
        private String id;

        @NotBlank(message = "element type is required")
        @Size(max = 100)
        private String type;

        private String name;

        /**
         * Needed only for element types the service does not know.
         */
        private ArchitectureLayer layer;

        private Map<String, Object> properties;

        private Instant lastModified;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RelationshipPayload {
        @NotBlank
        private String sourceType;

        @NotBlank
        private String sourceId;

        @NotBlank
        private String targetType;

        @NotBlank
        private String targetId;

        @NotBlank
        @Size(max = 100)
        private String relationshipType;
    }
}
