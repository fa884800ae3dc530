package com.archvalidation.domain.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which relationships of an element a {@code links} predicate counts.
 */
public enum LinkDirection {
    OUTGOING("outgoing"),
    INCOMING("incoming"),
    ANY("any");

    private final String value;

    LinkDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LinkDirection fromValue(String value) {
        for (LinkDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown link direction: " + value);
    }
}
