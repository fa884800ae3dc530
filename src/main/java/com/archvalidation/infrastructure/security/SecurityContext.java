package com.archvalidation.infrastructure.security;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable security context for a request.
 *
 * <p>Built from the verified token and threaded through every tenant-scoped
 * operation. The tenant id never comes from anywhere but the token.
 */
@Value
@Builder
public class SecurityContext {
    UUID requestId;
    String principalId;
    String tenantId;
    Role role;
    String sourceIp;
    Instant requestedAt;

    public boolean isAdministrator() {
        return role != null && role.isAdministrative();
    }
}
