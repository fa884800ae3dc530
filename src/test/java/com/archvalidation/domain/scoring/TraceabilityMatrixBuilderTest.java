package com.archvalidation.domain.scoring;

import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.ElementRelationship;
import com.archvalidation.domain.model.TraceabilityMatrixEntry;
import com.archvalidation.domain.rules.ArchitectureGraph;
import com.archvalidation.domain.rules.MissingLink;
import com.archvalidation.domain.rules.MissingLinkObservation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TraceabilityMatrixBuilderTest {

    private static final String TENANT = "tenant-a";
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private static ArchitectureElement element(String type, String id) {
        return ArchitectureElement.create(TENANT, type, id, id, null, Map.of(), NOW);
    }

    @Test
    void groupsConnectionsAndGapsIntoCells() {
        ArchitectureElement g1 = element("goal", "G1");
        ArchitectureElement g2 = element("goal", "G2");
        ArchitectureElement c1 = element("capability", "C1");
        ArchitectureGraph graph = ArchitectureGraph.of(List.of(g1, g2, c1), List.of(
            ElementRelationship.create(TENANT, g1.key(), c1.key(), "realizes"),
            ElementRelationship.create(TENANT, g2.key(), c1.key(), "realizes")));
        MissingLinkObservation gap = new MissingLinkObservation(ArchitectureLayer.MOTIVATION, "goal",
            new MissingLink(ArchitectureLayer.BUSINESS, "capability", "realizes"));

        List<TraceabilityMatrixEntry> matrix = TraceabilityMatrixBuilder.build(TENANT, graph, List.of(gap), NOW);

        assertEquals(1, matrix.size());
        TraceabilityMatrixEntry cell = matrix.get(0);
        assertEquals(ArchitectureLayer.MOTIVATION, cell.getSourceLayer());
        assertEquals(ArchitectureLayer.BUSINESS, cell.getTargetLayer());
        assertEquals(2, cell.getConnectionCount());
        assertEquals(1, cell.getMissingConnections());
        assertEquals(2.0 / 3.0, cell.getStrengthScore(), 1e-9);
        assertEquals(TENANT, cell.getTenantId());
    }

    @Test
    void gapWithUnknownTargetLayerIsSkipped() {
        MissingLinkObservation gap = new MissingLinkObservation(ArchitectureLayer.MOTIVATION, "goal",
            new MissingLink(null, MissingLink.ANY, MissingLink.ANY));

        assertTrue(TraceabilityMatrixBuilder.build(TENANT, ArchitectureGraph.empty(), List.of(gap), NOW).isEmpty());
    }

    @Test
    void gapOnlyCellHasZeroStrength() {
        MissingLinkObservation gap = new MissingLinkObservation(ArchitectureLayer.BUSINESS, "capability",
            new MissingLink(ArchitectureLayer.MOTIVATION, MissingLink.ANY, MissingLink.ANY));

        TraceabilityMatrixEntry cell = TraceabilityMatrixBuilder.build(
            TENANT, ArchitectureGraph.empty(), List.of(gap), NOW).get(0);

        assertEquals(0, cell.getConnectionCount());
        assertEquals(0.0, cell.getStrengthScore());
        assertEquals("*", cell.getTargetEntityType());
    }
}
