package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.IssueType;

/**
 * Interpreted form of a rule's logic document.
 *
 * @param target Elements the rule applies to
 * @param minCount Minimum number of targeted elements, or null for no population check
 * @param predicate Condition every targeted element must satisfy, or null for none
 * @param issueType Issue type forced on every issue of the rule, or null
 * @param recommendedFix Fix text forced on every issue of the rule, or null
 */
public record RuleLogic(
        RuleTarget target,
        Integer minCount,
        ElementPredicate predicate,
        IssueType issueType,
        String recommendedFix) {

    public void validate() {
        if (target == null) {
            throw new InvalidRuleLogicException("Rule logic requires a 'target'");
        }
        target.validate();
        if (minCount != null && minCount < 0) {
            throw new InvalidRuleLogicException("'min_count' must not be negative");
        }
        if (predicate == null && minCount == null) {
            throw new InvalidRuleLogicException("Rule logic requires a 'predicate' or a 'min_count'");
        }
        if (predicate != null) {
            predicate.validate();
        }
    }
}
