package com.archvalidation.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A modeled architecture element of a tenant (goal, capability, node, ...).
 *
 * <p>Identified inside a tenant by {@code (elementType, elementId)}, where
 * {@code elementId} is the external id used by the modeling tool.
 */
@Entity
@Table(name = "architecture_elements", uniqueConstraints = {
    @UniqueConstraint(name = "uk_element_tenant_type_id", columnNames = {"tenant_id", "element_type", "element_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ArchitectureElement {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "element_id", nullable = false, updatable = false)
    private String elementId;

    @Column(name = "element_type", nullable = false, updatable = false, length = 100)
    private String elementType;

    @Column(name = "name")
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "layer", nullable = false, length = 20)
    private ArchitectureLayer layer;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "properties", length = 8000)
    private Map<String, Object> properties;

    @Column(name = "last_modified", nullable = false)
    private Instant lastModified;

    private ArchitectureElement(
            String tenantId,
            String elementId,
            String elementType,
            String name,
            ArchitectureLayer layer,
            Map<String, Object> properties,
            Instant lastModified) {

        this.id = UUID.randomUUID();
        this.tenantId = tenantId;
        this.elementId = elementId;
        this.elementType = elementType;
        this.name = name;
        this.layer = layer;
        this.properties = properties != null ? new HashMap<>(properties) : new HashMap<>();
        this.lastModified = lastModified;
    }

    /**
     * Create an element, resolving its layer from the element type when none is given.
     *
     * @throws IllegalArgumentException if the type is unknown and no layer is given
     */
    public static ArchitectureElement create(
            String tenantId,
            String elementType,
            String elementId,
            String name,
            ArchitectureLayer layer,
            Map<String, Object> properties,
            Instant lastModified) {

        if (elementType == null || elementType.isBlank() || elementId == null || elementId.isBlank()) {
            throw new IllegalArgumentException("Element type and id are required");
        }
        String type = ElementKey.normalizeType(elementType);
        ArchitectureLayer resolved = layer != null ? layer : ArchitectureLayer.forElementType(type)
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown element type '" + elementType + "' and no layer given"));
        return new ArchitectureElement(
            tenantId, ElementKey.normalizeId(elementId), type, name, resolved, properties, lastModified);
    }

    /**
     * Overwrite the mutable attributes with those of a re-imported copy.
     */
    public void refreshFrom(ArchitectureElement incoming) {
        this.name = incoming.name;
        this.layer = incoming.layer;
        this.properties = new HashMap<>(incoming.properties);
        this.lastModified = incoming.lastModified;
    }

    public Map<String, Object> getProperties() {
        return properties != null ? Collections.unmodifiableMap(properties) : Map.of();
    }

    /**
     * Look up a field by name. {@code name} resolves to the element name,
     * everything else to the free-form properties.
     */
    public Object field(String field) {
        if ("name".equals(field)) {
            return name;
        }
        return properties != null ? properties.get(field) : null;
    }

    public ElementKey key() {
        return new ElementKey(elementType, elementId);
    }
}
