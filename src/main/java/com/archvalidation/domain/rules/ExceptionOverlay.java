package com.archvalidation.domain.rules;

import com.archvalidation.domain.model.ValidationExceptionRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The tenant's effective exceptions at one instant. Inactive and expired
 * records are dropped when the overlay is built.
 */
public final class ExceptionOverlay {

    private final List<ValidationExceptionRecord> effective;

    private ExceptionOverlay(List<ValidationExceptionRecord> effective) {
        this.effective = effective;
    }

    public static ExceptionOverlay of(Collection<ValidationExceptionRecord> exceptions, Instant now) {
        return new ExceptionOverlay(exceptions.stream()
            .filter(exception -> exception.isEffectiveAt(now))
            .toList());
    }

    public static ExceptionOverlay none() {
        return new ExceptionOverlay(List.of());
    }

    public Optional<ValidationExceptionRecord> findSuppressing(String entityType, String entityId, UUID ruleId) {
        return effective.stream()
            .filter(exception -> exception.covers(entityType, entityId, ruleId))
            .findFirst();
    }

    public boolean suppresses(String entityType, String entityId, UUID ruleId) {
        return findSuppressing(entityType, entityId, ruleId).isPresent();
    }

    public int size() {
        return effective.size();
    }
}
