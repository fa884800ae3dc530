package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.IssueType;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of applying a predicate to one element.
 *
 * <p>A failed verdict carries the reasons, the issue type suggested by the
 * first failing leaf (may be null) and the links found missing along the way.
 */
@Getter
public final class Verdict {

    private static final Verdict PASS = new Verdict(true, List.of(), null, List.of());

    private final boolean passed;
    private final List<String> reasons;
    private final IssueType suggestedIssueType;
    private final List<MissingLink> missingLinks;

    private Verdict(boolean passed, List<String> reasons, IssueType suggestedIssueType, List<MissingLink> missingLinks) {
        this.passed = passed;
        this.reasons = reasons;
        this.suggestedIssueType = suggestedIssueType;
        this.missingLinks = missingLinks;
    }

    public static Verdict pass() {
        return PASS;
    }

    public static Verdict fail(String reason, IssueType suggestedIssueType) {
        return new Verdict(false, List.of(reason), suggestedIssueType, List.of());
    }

    public static Verdict fail(String reason, IssueType suggestedIssueType, MissingLink missingLink) {
        return new Verdict(false, List.of(reason), suggestedIssueType, List.of(missingLink));
    }

    /**
     * Merge several failed verdicts, keeping the first suggestion that is set.
     */
    public static Verdict failAll(List<Verdict> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("At least one failed verdict is required");
        }
        List<String> reasons = new ArrayList<>();
        List<MissingLink> missing = new ArrayList<>();
        IssueType suggestion = null;
        for (Verdict failure : failures) {
            reasons.addAll(failure.reasons);
            missing.addAll(failure.missingLinks);
            if (suggestion == null) {
                suggestion = failure.suggestedIssueType;
            }
        }
        return new Verdict(false, List.copyOf(reasons), suggestion, List.copyOf(missing));
    }

    public boolean failed() {
        return !passed;
    }
}
