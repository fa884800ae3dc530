package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.ElementKey;
import com.archvalidation.domain.model.IssueType;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Holds when the element has at least {@code min} relationships matching the
 * given direction, far-end type or layer, and relationship type. Unset
 * constraints match anything; direction defaults to {@code any}, min to 1.
 */
public record LinksPredicate(
        @JsonProperty("direction") LinkDirection direction,
        @JsonProperty("target_type") String targetType,
        @JsonProperty("target_layer") ArchitectureLayer targetLayer,
        @JsonProperty("relationship_type") String relationshipType,
        @JsonProperty("min") Integer min) implements ElementPredicate {

    @Override
    public Verdict test(ArchitectureElement element, EvaluationScope scope) {
        ElementKey key = element.key();
        ArchitectureGraph graph = scope.graph();
        long found = graph.links(key, effectiveDirection()).stream()
            .filter(link -> matches(link, graph))
            .count();
        int required = effectiveMin();
        if (found >= required) {
            return Verdict.pass();
        }
        IssueType suggestion = graph.degree(key) == 0 ? IssueType.ORPHANED : IssueType.MISSING_LINK;
        String reason = String.format("has %d of %d required %s link(s)%s",
            found, required, effectiveDirection().getValue(), describeConstraints());
        return Verdict.fail(reason, suggestion, expectedLink());
    }

    @Override
    public void validate() {
        if (min != null && min < 0) {
            throw new InvalidRuleLogicException("'links' min must not be negative");
        }
        if (targetType != null && targetType.isBlank()) {
            throw new InvalidRuleLogicException("'links' target_type must not be blank");
        }
    }

    LinkDirection effectiveDirection() {
        return direction != null ? direction : LinkDirection.ANY;
    }

    int effectiveMin() {
        return min != null ? min : 1;
    }

    private boolean matches(ArchitectureGraph.Link link, ArchitectureGraph graph) {
        if (targetType != null && !targetType.equalsIgnoreCase(link.other().type())) {
            return false;
        }
        if (relationshipType != null && !relationshipType.equalsIgnoreCase(link.relationship().getRelationshipType())) {
            return false;
        }
        if (targetLayer != null) {
            return graph.layerOf(link.other()).map(targetLayer::equals).orElse(false);
        }
        return true;
    }

    private MissingLink expectedLink() {
        ArchitectureLayer layer = targetLayer;
        if (layer == null && targetType != null) {
            layer = ArchitectureLayer.forElementType(targetType).orElse(null);
        }
        return new MissingLink(
            layer,
            targetType != null ? targetType.toLowerCase() : MissingLink.ANY,
            relationshipType != null ? relationshipType.toLowerCase() : MissingLink.ANY);
    }

    private String describeConstraints() {
        StringBuilder description = new StringBuilder();
        if (relationshipType != null) {
            description.append(" of type '").append(relationshipType).append('\'');
        }
        if (targetType != null) {
            description.append(" to ").append(targetType);
        }
        if (targetLayer != null) {
            description.append(" in layer ").append(targetLayer.getValue());
        }
        return description.toString();
    }
}
