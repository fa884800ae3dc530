package com.archvalidation.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArchitectureElementTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    void keyIsCanonicalizedLikeExceptionEntities() {
        ArchitectureElement element = ArchitectureElement.create("tenant-a", " Goal ", " G1 ", "Grow", null, Map.of(), NOW);

        assertEquals("goal", element.getElementType());
        assertEquals("G1", element.getElementId());
        assertEquals(ElementKey.normalized("GOAL", "G1  "), element.key());
        assertEquals(ArchitectureLayer.MOTIVATION, element.getLayer());
    }

    @Test
    void relationshipEndsAreCanonicalized() {
        ElementRelationship relationship = ElementRelationship.create("tenant-a",
            new ElementKey("Goal", "G1 "), new ElementKey(" capability", " C1"), "realizes");

        assertEquals(new ElementKey("goal", "G1"), relationship.source());
        assertEquals(new ElementKey("capability", "C1"), relationship.target());
    }

    @Test
    void unknownTypeWithoutLayerIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ArchitectureElement.create("tenant-a", "gizmo", "X1", "X", null, Map.of(), NOW));
    }
}
