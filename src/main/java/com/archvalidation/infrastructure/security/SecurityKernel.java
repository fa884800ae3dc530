package com.archvalidation.infrastructure.security;

/**
 * Central authorization decisions of the service.
 */
public interface SecurityKernel {

    /**
     * Require an administrative role (Admin or Owner).
     *
     * @param context Caller
     * @param operation Operation name for logs
     */
    void authorizeAdministration(SecurityContext context, String operation);

    /**
     * Require that a resource belongs to the caller's tenant.
     *
     * @param context Caller
     * @param resourceTenantId Tenant owning the resource
     * @param operation Operation name for logs
     */
    void authorizeTenantAccess(SecurityContext context, String resourceTenantId, String operation);
}
