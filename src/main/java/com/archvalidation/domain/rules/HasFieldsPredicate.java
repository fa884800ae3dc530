package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.IssueType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Holds when every listed field is present and not empty.
 */
public record HasFieldsPredicate(@JsonProperty("fields") List<String> fields) implements ElementPredicate {

    @Override
    public Verdict test(ArchitectureElement element, EvaluationScope scope) {
        List<String> missing = fields.stream()
            .filter(field -> isEmpty(element.field(field)))
            .toList();
        if (missing.isEmpty()) {
            return Verdict.pass();
        }
        return Verdict.fail("missing required fields: " + String.join(", ", missing), IssueType.INVALID_ENUM);
    }

    @Override
    public void validate() {
        if (fields == null || fields.isEmpty()) {
            throw new InvalidRuleLogicException("'has_fields' requires a non-empty 'fields' list");
        }
        if (fields.stream().anyMatch(field -> field == null || field.isBlank())) {
            throw new InvalidRuleLogicException("'has_fields' field names must not be blank");
        }
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).isBlank();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        return false;
    }
}
