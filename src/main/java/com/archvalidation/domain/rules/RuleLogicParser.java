package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.IssueType;
import com.archvalidation.domain.model.RuleType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Reads rule logic documents into {@link RuleLogic}.
 *
 * <p>Two shapes are accepted. The structured shape has a {@code target} and a
 * {@code predicate} tree keyed by {@code op}. The flat shapes older rules use
 * are translated into the structured one:
 * <ul>
 *   <li>{@code {source_type, target_type, relationship_type, min_connections}}: outgoing links check</li>
 *   <li>{@code {element_type, required_fields, min_count}}: population count plus required fields</li>
 *   <li>{@code {source_layer, target_layer}}: at least one link in either direction into the target layer</li>
 * </ul>
 */
public class RuleLogicParser {

    private static final Set<String> STRUCTURED_KEYS =
        Set.of("target", "min_count", "predicate", "issue_type", "recommended_fix");

    private final ObjectMapper mapper;

    public RuleLogicParser() {
        this.mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build();
    }

    /**
     * Parse and validate a rule logic document.
     *
     * @param ruleLogic JSON document
     * @param ruleType Type of the owning rule, used to disambiguate flat documents
     * @return Validated logic
     * @throws InvalidRuleLogicException if the document cannot be interpreted
     */
    public RuleLogic parse(String ruleLogic, RuleType ruleType) {
        if (ruleLogic == null || ruleLogic.isBlank()) {
            throw new InvalidRuleLogicException("Rule logic is empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(ruleLogic);
        } catch (JsonProcessingException e) {
            throw new InvalidRuleLogicException("Rule logic is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidRuleLogicException("Rule logic must be a JSON object");
        }

        RuleLogic logic;
        try {
            logic = isStructured(root) ? readStructured(root) : translateFlat(root, ruleType);
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleLogicException(e.getMessage(), e);
        }
        logic.validate();
        return logic;
    }

    private static boolean isStructured(JsonNode root) {
        return root.has("target") || root.has("predicate");
    }

    private RuleLogic readStructured(JsonNode root) {
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!STRUCTURED_KEYS.contains(name)) {
                throw new InvalidRuleLogicException("Unknown rule logic property: " + name);
            }
        }

        RuleTarget target = convert(root.get("target"), RuleTarget.class, "target");
        ElementPredicate predicate = convert(root.get("predicate"), ElementPredicate.class, "predicate");
        Integer minCount = readOptionalInt(root, "min_count");
        IssueType issueType = root.hasNonNull("issue_type") ? IssueType.fromValue(root.get("issue_type").asText()) : null;
        String recommendedFix = root.hasNonNull("recommended_fix") ? root.get("recommended_fix").asText() : null;

        return new RuleLogic(target, minCount, predicate, issueType, recommendedFix);
    }

    private RuleLogic translateFlat(JsonNode root, RuleType ruleType) {
        if (root.has("source_type") || (ruleType == RuleType.TRACEABILITY && !root.has("source_layer"))) {
            return translateTraceability(root);
        }
        if (root.has("element_type") || (ruleType == RuleType.COMPLETENESS && !root.has("source_layer"))) {
            return translateCompleteness(root);
        }
        if (root.has("source_layer") || ruleType == RuleType.ALIGNMENT) {
            return translateAlignment(root);
        }
        throw new InvalidRuleLogicException("Unrecognised rule logic shape");
    }

    private RuleLogic translateTraceability(JsonNode root) {
        String sourceType = requireText(root, "source_type");
        String targetType = optionalText(root, "target_type");
        String relationshipType = optionalText(root, "relationship_type");
        Integer minConnections = readOptionalInt(root, "min_connections");
        int min = minConnections != null ? minConnections : 1;

        String fix = String.format("Create %s relationship to at least %d %s element(s)",
            relationshipType != null ? relationshipType : "a",
            min,
            targetType != null ? targetType : "target");

        return new RuleLogic(
            new RuleTarget(sourceType.toLowerCase(), null),
            null,
            new LinksPredicate(LinkDirection.OUTGOING, targetType, null, relationshipType, min),
            IssueType.MISSING_LINK,
            fix);
    }

    private RuleLogic translateCompleteness(JsonNode root) {
        String elementType = requireText(root, "element_type");
        List<String> requiredFields = new ArrayList<>();
        JsonNode fieldsNode = root.get("required_fields");
        if (fieldsNode != null && !fieldsNode.isNull()) {
            if (!fieldsNode.isArray()) {
                throw new InvalidRuleLogicException("'required_fields' must be an array");
            }
            fieldsNode.forEach(field -> requiredFields.add(field.asText()));
        }
        Integer minCount = readOptionalInt(root, "min_count");

        return new RuleLogic(
            new RuleTarget(elementType.toLowerCase(), null),
            minCount != null ? minCount : 1,
            requiredFields.isEmpty() ? null : new HasFieldsPredicate(List.copyOf(requiredFields)),
            null,
            null);
    }

    private RuleLogic translateAlignment(JsonNode root) {
        ArchitectureLayer sourceLayer = ArchitectureLayer.fromValue(requireText(root, "source_layer"));
        ArchitectureLayer targetLayer = ArchitectureLayer.fromValue(requireText(root, "target_layer"));

        return new RuleLogic(
            new RuleTarget(null, sourceLayer),
            null,
            new LinksPredicate(LinkDirection.ANY, null, targetLayer, null, 1),
            IssueType.BROKEN_TRACEABILITY,
            "Create alignment relationships with " + targetLayer.getValue() + " elements");
    }

    private <T> T convert(JsonNode node, Class<T> type, String property) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new InvalidRuleLogicException("Invalid '" + property + "': " + e.getOriginalMessage(), e);
        }
    }

    private static Integer readOptionalInt(JsonNode root, String property) {
        JsonNode node = root.get(property);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new InvalidRuleLogicException("'" + property + "' must be an integer");
        }
        return node.intValue();
    }

    private static String requireText(JsonNode root, String property) {
        String value = optionalText(root, property);
        if (value == null) {
            throw new InvalidRuleLogicException("'" + property + "' is required");
        }
        return value;
    }

    private static String optionalText(JsonNode root, String property) {
        JsonNode node = root.get(property);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new InvalidRuleLogicException("'" + property + "' must be a non-empty string");
        }
        return node.asText();
    }
}
