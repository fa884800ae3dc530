package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.ElementKey;
import com.archvalidation.domain.model.ElementRelationship;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only, in-memory view of one tenant's model, indexed for the evaluator.
 */
public final class ArchitectureGraph {

    private final Map<ElementKey, ArchitectureElement> elements;
    private final List<ElementRelationship> relationships;
    private final Map<ElementKey, List<ElementRelationship>> outgoing = new HashMap<>();
    private final Map<ElementKey, List<ElementRelationship>> incoming = new HashMap<>();

    private ArchitectureGraph(Collection<ArchitectureElement> elements, Collection<ElementRelationship> relationships) {
        Map<ElementKey, ArchitectureElement> index = new LinkedHashMap<>();
        for (ArchitectureElement element : elements) {
            index.put(element.key(), element);
        }
        this.elements = Collections.unmodifiableMap(index);
        this.relationships = List.copyOf(relationships);
        for (ElementRelationship relationship : relationships) {
            outgoing.computeIfAbsent(relationship.source(), key -> new ArrayList<>()).add(relationship);
            incoming.computeIfAbsent(relationship.target(), key -> new ArrayList<>()).add(relationship);
        }
    }

    public static ArchitectureGraph of(Collection<ArchitectureElement> elements, Collection<ElementRelationship> relationships) {
        return new ArchitectureGraph(elements, relationships);
    }

    public static ArchitectureGraph empty() {
        return new ArchitectureGraph(List.of(), List.of());
    }

    public Collection<ArchitectureElement> elements() {
        return elements.values();
    }

    public List<ElementRelationship> relationships() {
        return relationships;
    }

    public int size() {
        return elements.size();
    }

    public Optional<ArchitectureElement> find(ElementKey key) {
        return Optional.ofNullable(elements.get(key));
    }

    /**
     * Layer of a model element, or of its type when the element is not in the model.
     */
    public Optional<ArchitectureLayer> layerOf(ElementKey key) {
        ArchitectureElement element = elements.get(key);
        if (element != null) {
            return Optional.of(element.getLayer());
        }
        return ArchitectureLayer.forElementType(key.type());
    }

    /**
     * Relationships touching {@code key} in the given direction, each paired with the element at the other end.
     */
    public List<Link> links(ElementKey key, LinkDirection direction) {
        List<Link> result = new ArrayList<>();
        if (direction != LinkDirection.INCOMING) {
            for (ElementRelationship relationship : outgoing.getOrDefault(key, List.of())) {
                result.add(new Link(relationship, relationship.target()));
            }
        }
        if (direction != LinkDirection.OUTGOING) {
            for (ElementRelationship relationship : incoming.getOrDefault(key, List.of())) {
                result.add(new Link(relationship, relationship.source()));
            }
        }
        return result;
    }

    public int degree(ElementKey key) {
        return outgoing.getOrDefault(key, List.of()).size() + incoming.getOrDefault(key, List.of()).size();
    }

    /**
     * A relationship seen from one of its ends.
     */
    public record Link(ElementRelationship relationship, ElementKey other) {
    }
}
