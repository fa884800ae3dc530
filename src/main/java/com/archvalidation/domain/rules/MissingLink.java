package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureLayer;

/**
 * A relationship a {@code links} predicate expected but did not find.
 * {@code "*"} stands for an unconstrained type.
 */
public record MissingLink(ArchitectureLayer targetLayer, String targetType, String relationshipType) {

    public static final String ANY = "*";
}
