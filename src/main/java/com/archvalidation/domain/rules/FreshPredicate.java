package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.IssueType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Holds when the element was modified within the last {@code max_age_days} days.
 */
public record FreshPredicate(@JsonProperty("max_age_days") Integer maxAgeDays) implements ElementPredicate {

    @Override
    public Verdict test(ArchitectureElement element, EvaluationScope scope) {
        Instant oldestAccepted = scope.now().minus(Duration.ofDays(maxAgeDays));
        if (!element.getLastModified().isBefore(oldestAccepted)) {
            return Verdict.pass();
        }
        return Verdict.fail(
            "not modified since " + element.getLastModified() + " (limit " + maxAgeDays + " days)",
            IssueType.STALE);
    }

    @Override
    public void validate() {
        if (maxAgeDays == null || maxAgeDays <= 0) {
            throw new InvalidRuleLogicException("'fresh' requires a positive 'max_age_days'");
        }
    }
}
