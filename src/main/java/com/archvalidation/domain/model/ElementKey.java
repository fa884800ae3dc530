package com.archvalidation.domain.model;

/**
 * Tenant-local identity of an architecture element.
 */
public record ElementKey(String type, String id) {

    /**
     * Key in canonical form: type trimmed and lower-cased, id trimmed.
     * Elements, relationship ends and exceptions are all keyed this way.
     */
    public static ElementKey normalized(String type, String id) {
        return new ElementKey(normalizeType(type), normalizeId(id));
    }

    public static String normalizeType(String type) {
        return type == null ? null : type.trim().toLowerCase();
    }

    public static String normalizeId(String id) {
        return id == null ? null : id.trim();
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
