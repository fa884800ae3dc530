package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureElement;
import com.archvalidation.domain.model.IssueType;
import com.archvalidation.domain.model.Severity;
import com.archvalidation.domain.model.ValidationIssue;
import com.archvalidation.domain.model.ValidationRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies one rule to a tenant's model.
 *
 * <p>Every targeted element is one check, and so is the optional population
 * count. A failed check becomes an issue unless an effective exception
 * covers it, in which case it is counted as suppressed and treated as passed.
 *
 * <p>A rule whose logic cannot be read does not abort the cycle: it yields a
 * single high-severity issue on the rule itself and performs no checks.
 */
@Slf4j
@RequiredArgsConstructor
public class RuleEvaluator {

    public static final String RULE_ENTITY_TYPE = "validation_rule";
    public static final String POPULATION_ENTITY_ID = "*";

    // Keeps the serialized metadata of one issue inside its column.
    static final int METADATA_VALUE_MAX_LENGTH = 200;
    static final int METADATA_ERROR_MAX_LENGTH = 1000;
    static final int METADATA_REASONS_MAX_LENGTH = 1200;
    private static final int MIN_REASON_LENGTH = 20;

    private final RuleLogicParser parser;

    /**
     * Evaluate a rule.
     *
     * @param rule Active rule
     * @param graph Tenant model
     * @param overlay Effective exceptions of the tenant
     * @param now Evaluation instant
     * @param checkpoint Called before every check; may throw to abort the evaluation
     * @return Checks, failures and issue candidates of this rule
     */
    public RuleResult evaluate(
            ValidationRule rule,
            ArchitectureGraph graph,
            ExceptionOverlay overlay,
            Instant now,
            Runnable checkpoint) {

        RuleLogic logic;
        try {
            logic = parser.parse(rule.getRuleLogic(), rule.getRuleType());
        } catch (InvalidRuleLogicException e) {
            log.warn("Rule logic not interpretable: rule={} name={} reason={}",
                rule.getId(), rule.getName(), e.getMessage());
            return uninterpretable(rule, overlay, e);
        }

        Accumulator acc = new Accumulator(rule, overlay);
        EvaluationScope scope = new EvaluationScope(graph, now);
        List<ArchitectureElement> targets = logic.target().select(graph);

        if (logic.minCount() != null) {
            checkpoint.run();
            checkPopulation(logic, targets.size(), acc);
        }

        if (logic.predicate() != null) {
            for (ArchitectureElement element : targets) {
                checkpoint.run();
                Verdict verdict = logic.predicate().test(element, scope);
                acc.checks++;
                if (verdict.failed()) {
                    recordElementFailure(logic, element, verdict, acc);
                }
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Rule evaluated: rule={} checks={} failures={} suppressed={}",
                rule.getName(), acc.checks, acc.failures, acc.suppressed);
        }

        return new RuleResult(
            rule.getId(), rule.getRuleType(), rule.getScope(),
            acc.checks, acc.failures, acc.suppressed,
            List.copyOf(acc.issues), List.copyOf(acc.missingLinks), true);
    }

    private void checkPopulation(RuleLogic logic, int found, Accumulator acc) {
        acc.checks++;
        int required = logic.minCount();
        if (found >= required) {
            return;
        }
        String entityType = logic.target().entityType();
        if (acc.suppress(entityType, POPULATION_ENTITY_ID)) {
            return;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rule_name", acc.rule.getName());
        metadata.put("target", ValidationIssue.abbreviate(logic.target().toString(), METADATA_VALUE_MAX_LENGTH));
        metadata.put("actual_count", found);
        metadata.put("required_count", required);

        IssueType issueType = logic.issueType() != null ? logic.issueType() : IssueType.MISSING_LINK;
        acc.failures++;
        acc.issues.add(IssueCandidate.builder()
            .ruleId(acc.rule.getId())
            .entityType(entityType)
            .entityId(POPULATION_ENTITY_ID)
            .layer(acc.rule.getScope())
            .issueType(issueType)
            .severity(acc.rule.getSeverity())
            .description(String.format("Insufficient %s: %d found, %d required",
                logic.target(), found, required))
            .recommendedFix(logic.recommendedFix() != null
                ? logic.recommendedFix()
                : String.format("Create at least %d %s", required, logic.target()))
            .metadata(metadata)
            .build());
    }

    private void recordElementFailure(RuleLogic logic, ArchitectureElement element, Verdict verdict, Accumulator acc) {
        if (acc.suppress(element.getElementType(), element.getElementId())) {
            return;
        }

        IssueType issueType = resolveIssueType(logic, verdict, acc.rule);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rule_name", acc.rule.getName());
        metadata.put("element_name", ValidationIssue.abbreviate(element.getName(), METADATA_VALUE_MAX_LENGTH));
        metadata.put("element_layer", element.getLayer().getValue());
        List<String> reasons = boundedReasons(verdict.getReasons());
        metadata.put("reasons", reasons);
        if (reasons.size() < verdict.getReasons().size()) {
            metadata.put("reasons_omitted", verdict.getReasons().size() - reasons.size());
        }
        if (!verdict.getMissingLinks().isEmpty()) {
            metadata.put("missing_links", verdict.getMissingLinks().size());
        }

        acc.failures++;
        acc.issues.add(IssueCandidate.builder()
            .ruleId(acc.rule.getId())
            .entityType(element.getElementType())
            .entityId(element.getElementId())
            .layer(acc.rule.getScope())
            .issueType(issueType)
            .severity(acc.rule.getSeverity())
            .description(String.format("%s (%s) failed rule '%s': %s",
                displayName(element), element.getElementType(), acc.rule.getName(),
                String.join("; ", verdict.getReasons())))
            .recommendedFix(logic.recommendedFix() != null ? logic.recommendedFix() : defaultFix(issueType))
            .metadata(metadata)
            .build());

        for (MissingLink link : verdict.getMissingLinks()) {
            acc.missingLinks.add(new MissingLinkObservation(element.getLayer(), element.getElementType(), link));
        }
    }

    static IssueType resolveIssueType(RuleLogic logic, Verdict verdict, ValidationRule rule) {
        if (logic.issueType() != null) {
            return logic.issueType();
        }
        if (verdict.getSuggestedIssueType() != null) {
            return verdict.getSuggestedIssueType();
        }
        return rule.getRuleType().getDefaultIssueType();
    }

    private RuleResult uninterpretable(ValidationRule rule, ExceptionOverlay overlay, InvalidRuleLogicException cause) {
        String ruleId = rule.getId().toString();
        if (overlay.suppresses(RULE_ENTITY_TYPE, ruleId, rule.getId())) {
            return new RuleResult(rule.getId(), rule.getRuleType(), rule.getScope(),
                0, 0, 1, List.of(), List.of(), false);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("rule_name", rule.getName());
        metadata.put("error", ValidationIssue.abbreviate(cause.getMessage(), METADATA_ERROR_MAX_LENGTH));

        IssueCandidate issue = IssueCandidate.builder()
            .ruleId(rule.getId())
            .entityType(RULE_ENTITY_TYPE)
            .entityId(ruleId)
            .layer(rule.getScope())
            .issueType(IssueType.BROKEN_TRACEABILITY)
            .severity(Severity.HIGH)
            .description("Rule '" + rule.getName() + "' could not be evaluated: " + cause.getMessage())
            .recommendedFix("Correct the rule logic or deactivate the rule")
            .metadata(metadata)
            .build();

        return new RuleResult(rule.getId(), rule.getRuleType(), rule.getScope(),
            0, 0, 0, List.of(issue), List.of(), false);
    }

    /**
     * Leading reasons that fit {@link #METADATA_REASONS_MAX_LENGTH}, the last one possibly cut.
     */
    static List<String> boundedReasons(List<String> reasons) {
        List<String> kept = new ArrayList<>();
        int budget = METADATA_REASONS_MAX_LENGTH;
        for (String reason : reasons) {
            if (budget < MIN_REASON_LENGTH) {
                break;
            }
            String cut = ValidationIssue.abbreviate(reason, budget);
            kept.add(cut);
            budget -= cut.length();
        }
        return kept;
    }

    private static String displayName(ArchitectureElement element) {
        return element.getName() != null && !element.getName().isBlank()
            ? element.getName()
            : element.getElementId();
    }

    private static String defaultFix(IssueType issueType) {
        return switch (issueType) {
            case MISSING_LINK -> "Add the missing relationships";
            case ORPHANED -> "Connect the element to the rest of the model or remove it";
            case STALE -> "Review the element and confirm it is still current";
            case INVALID_ENUM -> "Complete or correct the element's fields";
            case BROKEN_TRACEABILITY -> "Restore the traceability path between the affected layers";
        };
    }

    /**
     * Mutable per-rule counters.
     */
    private static final class Accumulator {
        private final ValidationRule rule;
        private final ExceptionOverlay overlay;
        private final List<IssueCandidate> issues = new ArrayList<>();
        private final List<MissingLinkObservation> missingLinks = new ArrayList<>();
        private int checks;
        private int failures;
        private int suppressed;

        private Accumulator(ValidationRule rule, ExceptionOverlay overlay) {
            this.rule = rule;
            this.overlay = overlay;
        }

        private boolean suppress(String entityType, String entityId) {
            if (overlay.suppresses(entityType, entityId, rule.getId())) {
                suppressed++;
                return true;
            }
            return false;
        }
    }
}
