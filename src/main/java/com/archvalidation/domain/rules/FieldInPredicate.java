package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.IssueType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Holds when a field's value is one of an allowed set.
 */
public record FieldInPredicate(
        @JsonProperty("field") String field,
        @JsonProperty("values") List<String> values) implements ElementPredicate {

    @Override
    public Verdict test(ArchitectureElement element, EvaluationScope scope) {
        Object value = element.field(field);
        if (value != null && values.contains(String.valueOf(value))) {
            return Verdict.pass();
        }
        String reason = value == null
            ? "field '" + field + "' is not set"
            : "field '" + field + "' has value '" + value + "', expected one of " + values;
        return Verdict.fail(reason, IssueType.INVALID_ENUM);
    }

    @Override
    public void validate() {
        if (field == null || field.isBlank()) {
            throw new InvalidRuleLogicException("'field_in' requires a 'field'");
        }
        if (values == null || values.isEmpty()) {
            throw new InvalidRuleLogicException("'field_in' requires a non-empty 'values' list");
        }
    }
}
