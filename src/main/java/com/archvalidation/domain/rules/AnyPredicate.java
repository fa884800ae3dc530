package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds when at least one child holds.
 */
public record AnyPredicate(@JsonProperty("of") List<ElementPredicate> of) implements ElementPredicate {

    @Override
    public Verdict test(ArchitectureElement element, EvaluationScope scope) {
        List<Verdict> failures = new ArrayList<>();
        for (ElementPredicate child : of) {
            Verdict verdict = child.test(element, scope);
            if (verdict.isPassed()) {
                return Verdict.pass();
            }
            failures.add(verdict);
        }
        return Verdict.failAll(failures);
    }

    @Override
    public void validate() {
        if (of == null || of.isEmpty()) {
            throw new InvalidRuleLogicException("'any' requires a non-empty 'of' list");
        }
        of.forEach(ElementPredicate::validate);
    }
}
