package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inverts its child. A failure here carries no issue type suggestion, so the
 * rule's own default applies.
 */
public record NotPredicate(@JsonProperty("predicate") ElementPredicate predicate) implements ElementPredicate {

    @Override
    public Verdict test(ArchitectureElement element, EvaluationScope scope) {
        Verdict inner = predicate.test(element, scope);
        if (inner.failed()) {
            return Verdict.pass();
        }
        return Verdict.fail("negated condition holds for " + element.key(), null);
    }

    @Override
    public void validate() {
        if (predicate == null) {
            throw new InvalidRuleLogicException("'not' requires a 'predicate'");
        }
        predicate.validate();
    }
}
