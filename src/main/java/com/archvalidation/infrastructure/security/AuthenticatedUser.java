package com.archvalidation.infrastructure.security;

import java.time.Instant;

/**
 * Identity established from a verified bearer token. Used as the Spring
 * Security principal.
 */
public record AuthenticatedUser(String userId, String tenantId, Role role, Instant expiresAt) {
}
