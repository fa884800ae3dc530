package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.ArchitectureLayer;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Selects the elements a rule applies to, by element type, by layer, or by both.
 */
public record RuleTarget(
        @JsonProperty("element_type") String elementType,
        @JsonProperty("layer") ArchitectureLayer layer) {

    public List<ArchitectureElement> select(ArchitectureGraph graph) {
        return graph.elements().stream()
            .filter(this::matches)
            .toList();
    }

    public boolean matches(ArchitectureElement element) {
        if (elementType != null && !elementType.equalsIgnoreCase(element.getElementType())) {
            return false;
        }
        return layer == null || layer == element.getLayer();
    }

    /**
     * Layer implied by the target, if any.
     */
    public Optional<ArchitectureLayer> impliedLayer() {
        if (layer != null) {
            return Optional.of(layer);
        }
        return ArchitectureLayer.forElementType(elementType);
    }

    /**
     * Entity type used for population-level issues.
     */
    public String entityType() {
        if (elementType != null) {
            return elementType.toLowerCase();
        }
        return layer.getValue().toLowerCase() + "_element";
    }

    void validate() {
        if ((elementType == null || elementType.isBlank()) && layer == null) {
            throw new InvalidRuleLogicException("Rule target requires 'element_type' or 'layer'");
        }
    }

    @Override
    public String toString() {
        if (elementType != null && layer != null) {
            return elementType + " in " + layer.getValue();
        }
        return elementType != null ? elementType : layer.getValue() + " elements";
    }
}
