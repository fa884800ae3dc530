package com.archvalidation.application;

import com.archvalidation.infrastructure.security.AuthenticatedUser;
import com.archvalidation.infrastructure.security.SecurityContext;
import lombok.RequiredArgsConstructor;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetails;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Provider for current security context from Spring Security.
 *
 * Converts the {@link AuthenticatedUser} principal set by the bearer token
 * filter into the domain {@link SecurityContext}. Tenant and role come only
 * from the verified token.
 */
@Component
@RequiredArgsConstructor
public class SecurityContextProvider {

    private final Clock clock;

    public SecurityContext getCurrentContext() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()
                || !(authentication.getPrincipal() instanceof AuthenticatedUser)) {
            throw new AuthenticationCredentialsNotFoundException("No authenticated user");
        }
        AuthenticatedUser user = (AuthenticatedUser) authentication.getPrincipal();

        return SecurityContext.builder()
            .requestId(UUID.randomUUID())
            .principalId(user.userId())
            .tenantId(user.tenantId())
            .role(user.role())
            .sourceIp(extractSourceIp(authentication))
            .requestedAt(clock.instant())
            .build();
    }

    private static String extractSourceIp(Authentication authentication) {
        if (authentication.getDetails() instanceof WebAuthenticationDetails) {
            return ((WebAuthenticationDetails) authentication.getDetails()).getRemoteAddress();
        }
        return null;
    }
}
