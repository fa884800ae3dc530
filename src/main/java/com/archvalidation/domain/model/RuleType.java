package com.archvalidation.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rule families. Each family feeds one of the three scorecard dimensions.
 */
public enum RuleType {
    TRACEABILITY("traceability", IssueType.MISSING_LINK),
    COMPLETENESS("completeness", IssueType.INVALID_ENUM),
    ALIGNMENT("alignment", IssueType.BROKEN_TRACEABILITY);

    private final String value;
    private final IssueType defaultIssueType;

    RuleType(String value, IssueType defaultIssueType) {
        this.value = value;
        this.defaultIssueType = defaultIssueType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Issue type used when neither the rule logic nor the failing predicate names one.
     */
    public IssueType getDefaultIssueType() {
        return defaultIssueType;
    }

    @JsonCreator
    public static RuleType fromValue(String value) {
        for (RuleType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown rule type: " + value);
    }
}
