package com.archvalidation.domain.rules;

import java.time.Instant;

/**
 * What a predicate may look at besides the element itself.
 *
 * @param graph The tenant's model
 * @param now Evaluation instant, used for freshness and exception expiry
 */
public record EvaluationScope(ArchitectureGraph graph, Instant now) {
}
