package com.archvalidation.domain.scoring;

import com.archvalidation.domain.model.Severity;

/**
 * Issue counts per severity.
 */
public record SeverityCounts(int critical, int high, int medium, int low) {

    public static final SeverityCounts NONE = new SeverityCounts(0, 0, 0, 0);

    public SeverityCounts plus(Severity severity) {
        return switch (severity) {
            case CRITICAL -> new SeverityCounts(critical + 1, high, medium, low);
            case HIGH -> new SeverityCounts(critical, high + 1, medium, low);
            case MEDIUM -> new SeverityCounts(critical, high, medium + 1, low);
            case LOW -> new SeverityCounts(critical, high, medium, low + 1);
        };
    }

    public int total() {
        return critical + high + medium + low;
    }
}
