package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node of a rule's predicate tree. The {@code op} property of the JSON
 * document selects the implementation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "op")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AllPredicate.class, name = "all"),
    @JsonSubTypes.Type(value = AnyPredicate.class, name = "any"),
    @JsonSubTypes.Type(value = NotPredicate.class, name = "not"),
    @JsonSubTypes.Type(value = HasFieldsPredicate.class, name = "has_fields"),
    @JsonSubTypes.Type(value = FieldInPredicate.class, name = "field_in"),
    @JsonSubTypes.Type(value = LinksPredicate.class, name = "links"),
    @JsonSubTypes.Type(value = FreshPredicate.class, name = "fresh")
})
public interface ElementPredicate {

    Verdict test(ArchitectureElement element, EvaluationScope scope);

    /**
     * Check the predicate's arguments.
     *
     * @throws InvalidRuleLogicException if an argument is missing or out of range
     */
    void validate();
}
