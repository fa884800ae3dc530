package com.archvalidation.infrastructure.security;

/**
 * Roles carried in the {@code role} claim.
 */
public enum Role {
    VIEWER("Viewer"),
    EDITOR("Editor"),
    ADMIN("Admin"),
    OWNER("Owner");

    private final String claimValue;

    Role(String claimValue) {
        this.claimValue = claimValue;
    }

    public String getClaimValue() {
        return claimValue;
    }

    public String authority() {
        return "ROLE_" + name();
    }

    public boolean isAdministrative() {
        return this == ADMIN || this == OWNER;
    }

    /**
     * Map a claim value to a role. Missing and unrecognised values map to {@link #VIEWER}.
     */
    public static Role fromClaim(String claim) {
        if (claim == null) {
            return VIEWER;
        }
        for (Role role : values()) {
            if (role.claimValue.equalsIgnoreCase(claim.trim())) {
                return role;
            }
        }
        return VIEWER;
    }
}
