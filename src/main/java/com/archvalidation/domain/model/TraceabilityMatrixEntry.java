package com.archvalidation.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One cell of a tenant's traceability matrix. The whole matrix of a tenant is
 * replaced on every rebuild, rows are never updated in place.
 */
@Entity
@Table(name = "traceability_matrix", indexes = {
    @Index(name = "idx_traceability_matrix_tenant", columnList = "tenant_id, source_layer, target_layer")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TraceabilityMatrixEntry {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_layer", nullable = false, updatable = false, length = 20)
    private ArchitectureLayer sourceLayer;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_layer", nullable = false, updatable = false, length = 20)
    private ArchitectureLayer targetLayer;

    @Column(name = "source_entity_type", nullable = false, updatable = false, length = 100)
    private String sourceEntityType;

    @Column(name = "target_entity_type", nullable = false, updatable = false, length = 100)
    private String targetEntityType;

    @Column(name = "relationship_type", nullable = false, updatable = false, length = 100)
    private String relationshipType;

    @Column(name = "connection_count", nullable = false, updatable = false)
    private int connectionCount;

    @Column(name = "missing_connections", nullable = false, updatable = false)
    private int missingConnections;

    /**
     * Null when there is neither a connection nor a gap.
     */
    @Column(name = "strength_score", updatable = false)
    private Double strengthScore;

    @Column(name = "last_updated", nullable = false, updatable = false)
    private Instant lastUpdated;

    @Builder
    private TraceabilityMatrixEntry(
            String tenantId,
            ArchitectureLayer sourceLayer,
            ArchitectureLayer targetLayer,
            String sourceEntityType,
            String targetEntityType,
            String relationshipType,
            int connectionCount,
            int missingConnections,
            Instant lastUpdated) {

        if (connectionCount < 0 || missingConnections < 0) {
            throw new IllegalArgumentException("Matrix counts must not be negative");
        }
        this.id = UUID.randomUUID();
        this.tenantId = tenantId;
        this.sourceLayer = sourceLayer;
        this.targetLayer = targetLayer;
        this.sourceEntityType = sourceEntityType;
        this.targetEntityType = targetEntityType;
        this.relationshipType = relationshipType;
        this.connectionCount = connectionCount;
        this.missingConnections = missingConnections;
        this.strengthScore = strength(connectionCount, missingConnections);
        this.lastUpdated = lastUpdated;
    }

    static Double strength(int connections, int missing) {
        int total = connections + missing;
        if (total == 0) {
            return null;
        }
        return (double) connections / total;
    }
}
