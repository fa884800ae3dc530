package com.archvalidation.infrastructure.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Trusted Security Kernel - central authorization enforcement point.
 *
 * Enforces:
 * - Role checks for administrative operations (Admin, Owner)
 * - Tenant isolation for resources fetched by id
 *
 * Every denial is logged with the request id; grants are logged at debug.
 */
@Service
@Slf4j
public class TrustedSecurityKernel implements SecurityKernel {

    @Override
    public void authorizeAdministration(SecurityContext context, String operation) {
        log.debug("Authorization check [{}]: principal={}, tenant={}, operation={}, role={}",
            context.getRequestId(), context.getPrincipalId(), context.getTenantId(), operation, context.getRole());

        if (!context.isAdministrator()) {
            log.warn("AUTHORIZATION DENIED [{}]: Administrative role required - principal={}, " +
                "operation={}, role={}",
                context.getRequestId(), context.getPrincipalId(), operation, context.getRole());

            throw new AccessDeniedException(
                "Access denied: Admin or Owner role required for " + operation
            );
        }

        log.debug("AUTHORIZATION GRANTED [{}]: principal={}, operation={}",
            context.getRequestId(), context.getPrincipalId(), operation);
    }

    @Override
    public void authorizeTenantAccess(SecurityContext context, String resourceTenantId, String operation) {
        if (context.getTenantId() == null || !context.getTenantId().equals(resourceTenantId)) {
            log.warn("AUTHORIZATION DENIED [{}]: Cross-tenant access - principal={}, " +
                "operation={}, callerTenant={}",
                context.getRequestId(), context.getPrincipalId(), operation, context.getTenantId());

            throw new AccessDeniedException(
                "Access denied: Resource belongs to another tenant"
            );
        }
    }

    /**
     * Exception thrown when authorization fails.
     */
    public static class AccessDeniedException extends RuntimeException {
        public AccessDeniedException(String message) {
            super(message);
        }
    }
}
