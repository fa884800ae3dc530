package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.RuleType;

import java.util.List;
import java.util.UUID;

/**
 * What evaluating one rule against one tenant produced.
 *
 * @param checks Element and population checks performed
 * @param failures Checks that failed and were not suppressed
 * @param suppressed Checks that failed but are covered by an effective exception
 * @param interpretable False when the rule logic could not be read
 */
public record RuleResult(
        UUID ruleId,
        RuleType ruleType,
        ArchitectureLayer scope,
        int checks,
        int failures,
        int suppressed,
        List<IssueCandidate> issues,
        List<MissingLinkObservation> missingLinks,
        boolean interpretable) {
}
