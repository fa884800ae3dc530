package com.archvalidation.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Architecture layers a rule can be scoped to, with the element types that
 * belong to each of them.
 */
public enum ArchitectureLayer {
    MOTIVATION("Motivation",
        Set.of("goal", "driver", "constraint", "requirement", "assessment", "principle", "outcome")),
    BUSINESS("Business",
        Set.of("capability", "business_function", "business_process", "business_role", "business_service")),
    APPLICATION("Application",
        Set.of("application_function", "application_service", "application_component")),
    TECHNOLOGY("Technology",
        Set.of("node", "device", "systemsoftware", "technology_service")),
    IMPLEMENTATION("Implementation",
        Set.of("workpackage", "gap", "plateau", "deliverable"));

    private static final Map<String, ArchitectureLayer> LAYER_BY_TYPE = indexElementTypes();

    private final String value;
    private final Set<String> elementTypes;

    ArchitectureLayer(String value, Set<String> elementTypes) {
        this.value = value;
        this.elementTypes = elementTypes;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Set<String> getElementTypes() {
        return elementTypes;
    }

    /**
     * Resolve the layer of a known element type.
     */
    public static Optional<ArchitectureLayer> forElementType(String elementType) {
        if (elementType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(LAYER_BY_TYPE.get(elementType.toLowerCase()));
    }

    @JsonCreator
    public static ArchitectureLayer fromValue(String value) {
        for (ArchitectureLayer layer : values()) {
            if (layer.value.equalsIgnoreCase(value)) {
                return layer;
            }
        }
        throw new IllegalArgumentException("Unknown architecture layer: " + value);
    }

    private static Map<String, ArchitectureLayer> indexElementTypes() {
        Map<String, ArchitectureLayer> index = new HashMap<>();
        for (ArchitectureLayer layer : values()) {
            for (String type : layer.elementTypes) {
                index.put(type, layer);
            }
        }
        return Map.copyOf(index);
    }
}
