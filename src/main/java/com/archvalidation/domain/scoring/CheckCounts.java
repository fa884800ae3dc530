package com.archvalidation.domain.scoring;

/**
 * Checks performed and checks failed for one (layer, rule type) pair.
 */
public record CheckCounts(int checks, int failures) {

    public static final CheckCounts NONE = new CheckCounts(0, 0);

    public CheckCounts {
        if (checks < 0 || failures < 0 || failures > checks) {
            throw new IllegalArgumentException("Invalid check counts: checks=" + checks + " failures=" + failures);
        }
    }

    public CheckCounts plus(int moreChecks, int moreFailures) {
        return new CheckCounts(checks + moreChecks, failures + moreFailures);
    }

    /**
     * Share of passed checks; 1.0 when nothing was checked.
     */
    public double score() {
        if (checks == 0) {
            return 1.0;
        }
        return (double) (checks - failures) / checks;
    }
}
