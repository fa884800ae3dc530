package com.archvalidation.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A directed, typed relationship between two elements of the same tenant.
 */
@Entity
@Table(name = "element_relationships", indexes = {
    @Index(name = "idx_relationships_tenant_source", columnList = "tenant_id, source_type, source_id"),
    @Index(name = "idx_relationships_tenant_target", columnList = "tenant_id, target_type, target_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ElementRelationship {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "source_type", nullable = false, updatable = false, length = 100)
    private String sourceType;

    @Column(name = "source_id", nullable = false, updatable = false)
    private String sourceId;

    @Column(name = "target_type", nullable = false, updatable = false, length = 100)
    private String targetType;

    @Column(name = "target_id", nullable = false, updatable = false)
    private String targetId;

    @Column(name = "relationship_type", nullable = false, updatable = false, length = 100)
    private String relationshipType;

    private ElementRelationship(String tenantId, ElementKey source, ElementKey target, String relationshipType) {
        this.id = UUID.randomUUID();
        this.tenantId = tenantId;
        this.sourceType = source.type();
        this.sourceId = source.id();
        this.targetType = target.type();
        this.targetId = target.id();
        this.relationshipType = relationshipType;
    }

    public static ElementRelationship create(String tenantId, ElementKey source, ElementKey target, String relationshipType) {
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new IllegalArgumentException("Relationship type is required");
        }
        ElementKey normalizedSource = ElementKey.normalized(source.type(), source.id());
        ElementKey normalizedTarget = ElementKey.normalized(target.type(), target.id());
        return new ElementRelationship(tenantId, normalizedSource, normalizedTarget, relationshipType.trim().toLowerCase());
    }

    public ElementKey source() {
        return new ElementKey(sourceType, sourceId);
    }

    public ElementKey target() {
        return new ElementKey(targetType, targetId);
    }
}
