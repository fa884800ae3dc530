package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds when every child holds. All children are evaluated so that every
 * reason and missing link ends up on the issue.
 */
public record AllPredicate(@JsonProperty("of") List<ElementPredicate> of) implements ElementPredicate {

    @Override
    public Verdict test(ArchitectureElement element, EvaluationScope scope) {
        List<Verdict> failures = new ArrayList<>();
        for (ElementPredicate child : of) {
            Verdict verdict = child.test(element, scope);
            if (verdict.failed()) {
                failures.add(verdict);
            }
        }
        return failures.isEmpty() ? Verdict.pass() : Verdict.failAll(failures);
    }

    @Override
    public void validate() {
        if (of == null || of.isEmpty()) {
            throw new InvalidRuleLogicException("'all' requires a non-empty 'of' list");
        }
        of.forEach(ElementPredicate::validate);
    }
}
