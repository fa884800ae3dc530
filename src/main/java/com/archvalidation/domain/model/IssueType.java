package com.archvalidation.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of modeling defects the evaluator reports.
 */
public enum IssueType {
    MISSING_LINK("missing_link"),
    ORPHANED("orphaned"),
    STALE("stale"),
    INVALID_ENUM("invalid_enum"),
    BROKEN_TRACEABILITY("broken_traceability");

    private final String value;

    IssueType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static IssueType fromValue(String value) {
        for (IssueType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown issue type: " + value);
    }
}
