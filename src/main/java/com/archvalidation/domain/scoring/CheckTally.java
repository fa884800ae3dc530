package com.archvalidation.domain.scoring;

import com.archvalidation.domain.model.ArchitectureLayer;
import com.archvalidation.domain.model.RuleType;
import com.archvalidation.domain.rules.IssueCandidate;
import com.archvalidation.domain.rules.MissingLinkObservation;
import com.archvalidation.domain.rules.RuleResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Running totals of a validation cycle, fed one {@link RuleResult} at a time.
 * Not thread-safe; a cycle is evaluated on a single thread.
 */
public class CheckTally {

    private final Map<ArchitectureLayer, Map<RuleType, CheckCounts>> counts = new EnumMap<>(ArchitectureLayer.class);
    private final Map<ArchitectureLayer, SeverityCounts> severities = new EnumMap<>(ArchitectureLayer.class);
    private final List<IssueCandidate> issues = new ArrayList<>();
    private final List<MissingLinkObservation> missingLinks = new ArrayList<>();
    private int suppressed;
    private int rulesEvaluated;

    public void add(RuleResult result) {
        rulesEvaluated++;
        suppressed += result.suppressed();
        counts.computeIfAbsent(result.scope(), layer -> new EnumMap<>(RuleType.class))
            .merge(result.ruleType(), new CheckCounts(result.checks(), result.failures()),
                (current, added) -> current.plus(added.checks(), added.failures()));
        for (IssueCandidate issue : result.issues()) {
            issues.add(issue);
            ArchitectureLayer layer = issue.layer() != null ? issue.layer() : result.scope();
            severities.merge(layer, SeverityCounts.NONE.plus(issue.severity()),
                (current, added) -> current.plus(issue.severity()));
        }
        missingLinks.addAll(result.missingLinks());
    }

    public CheckCounts counts(ArchitectureLayer layer, RuleType ruleType) {
        return counts.getOrDefault(layer, Map.of()).getOrDefault(ruleType, CheckCounts.NONE);
    }

    public SeverityCounts severities(ArchitectureLayer layer) {
        return severities.getOrDefault(layer, SeverityCounts.NONE);
    }

    public List<IssueCandidate> issues() {
        return Collections.unmodifiableList(issues);
    }

    public List<MissingLinkObservation> missingLinks() {
        return Collections.unmodifiableList(missingLinks);
    }

    public int suppressed() {
        return suppressed;
    }

    public int rulesEvaluated() {
        return rulesEvaluated;
    }
}
