package com.archvalidation.domain.scoring;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.ElementRelationship;
import com.archvalidation.domain.model.TraceabilityMatrixEntry;
import com.archvalidation.domain.rules.ArchitectureGraph;
import com.archvalidation.domain.rules.MissingLinkObservation;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds a tenant's traceability matrix from its relationships and the links
 * the last evaluation found missing.
 *
 * <p>Cells are keyed by (source layer, target layer, source type, target
 * type, relationship type). Missing links whose target layer cannot be
 * determined are left out.
 */
public final class TraceabilityMatrixBuilder {

    private TraceabilityMatrixBuilder() {
    }

    public static List<TraceabilityMatrixEntry> build(
            String tenantId,
            ArchitectureGraph graph,
            Collection<MissingLinkObservation> missingLinks,
            Instant builtAt) {

        Map<CellKey, int[]> cells = new TreeMap<>();

        for (ElementRelationship relationship : graph.relationships()) {
            Optional<ArchitectureLayer> sourceLayer = graph.layerOf(relationship.source());
            Optional<ArchitectureLayer> targetLayer = graph.layerOf(relationship.target());
            if (sourceLayer.isEmpty() || targetLayer.isEmpty()) {
                continue;
            }
            CellKey key = new CellKey(sourceLayer.get(), targetLayer.get(),
                relationship.getSourceType(), relationship.getTargetType(), relationship.getRelationshipType());
            cells.computeIfAbsent(key, k -> new int[2])[0]++;
        }

        for (MissingLinkObservation observation : missingLinks) {
            if (observation.link().targetLayer() == null) {
                continue;
            }
            CellKey key = new CellKey(observation.sourceLayer(), observation.link().targetLayer(),
                observation.sourceType(), observation.link().targetType(), observation.link().relationshipType());
            cells.computeIfAbsent(key, k -> new int[2])[1]++;
        }

        return cells.entrySet().stream()
            .map(cell -> TraceabilityMatrixEntry.builder()
                .tenantId(tenantId)
                .sourceLayer(cell.getKey().sourceLayer())
                .targetLayer(cell.getKey().targetLayer())
                .sourceEntityType(cell.getKey().sourceType())
                .targetEntityType(cell.getKey().targetType())
                .relationshipType(cell.getKey().relationshipType())
                .connectionCount(cell.getValue()[0])
                .missingConnections(cell.getValue()[1])
                .lastUpdated(builtAt)
                .build())
            .toList();
    }

    private record CellKey(
            ArchitectureLayer sourceLayer,
            ArchitectureLayer targetLayer,
            String sourceType,
            String targetType,
            String relationshipType) implements Comparable<CellKey> {

        @Override
        public int compareTo(CellKey other) {
            int result = sourceLayer.compareTo(other.sourceLayer);
            if (result == 0) {
                result = targetLayer.compareTo(other.targetLayer);
            }
            if (result == 0) {
                result = sourceType.compareTo(other.sourceType);
            }
            if (result == 0) {
                result = targetType.compareTo(other.targetType);
            }
            if (result == 0) {
                result = relationshipType.compareTo(other.relationshipType);
            }
            return result;
        }
    }
}
