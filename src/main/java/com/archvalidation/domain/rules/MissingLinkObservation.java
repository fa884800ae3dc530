package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ArchitectureLayer;

/**
 * A missing link attributed to the element it was expected on.
 */
public record MissingLinkObservation(ArchitectureLayer sourceLayer, String sourceType, MissingLink link) {
}
