package com.archvalidation.application;

import com.archvalidation.application.exception.InvalidRequestException;
import com.archvalidation.application.exception.ResourceNotFoundException;
import com.archvalidation.config.PerformanceConfiguration.ValidationMetrics;
import com.archvalidation.domain.model.ElementKey;
import com.archvalidation.domain.model.ValidationExceptionRecord;
import com.archvalidation.domain.repository.ValidationExceptionRepository;
import com.archvalidation.domain.repository.ValidationRuleRepository;
import com.archvalidation.infrastructure.audit.AuditService;
import com.archvalidation.infrastructure.security.SecurityContext;
import com.archvalidation.infrastructure.security.SecurityKernel;
import com.archvalidation.interfaces.api.dto.CreateExceptionRequest;
import com.archvalidation.interfaces.api.dto.ValidationExceptionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Application service for validation exceptions (accepted modeling gaps).
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ExceptionService {

    private final ValidationExceptionRepository exceptionRepository;
    private final ValidationRuleRepository ruleRepository;
    private final SecurityKernel securityKernel;
    private final SecurityContextProvider securityContextProvider;
    private final AuditService auditService;
    private final ValidationMetrics metrics;
    private final Clock clock;

    /**
     * Create an exception in the caller's tenant.
     *
     * @throws ResourceNotFoundException if a rule id is given that does not exist
     * @throws InvalidRequestException if the expiry is not in the future
     */
    public ValidationExceptionResponse createException(CreateExceptionRequest request) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        securityKernel.authorizeAdministration(context, "exception.create");

        if (request.getRuleId() != null && !ruleRepository.existsById(request.getRuleId())) {
            throw ResourceNotFoundException.of("Validation rule", request.getRuleId());
        }

        Instant now = clock.instant();
        if (request.getExpiresAt() != null && !request.getExpiresAt().isAfter(now)) {
            throw new InvalidRequestException("Exception expiry must be in the future: " + request.getExpiresAt());
        }
        ValidationExceptionRecord exception = exceptionRepository.save(ValidationExceptionRecord.create(
            context.getTenantId(),
            ElementKey.normalizeType(request.getEntityType()),
            ElementKey.normalizeId(request.getEntityId()),
            request.getRuleId(),
            request.getReason(),
            context.getPrincipalId(),
            now,
            request.getExpiresAt()));

        auditService.record(AuditService.EXCEPTION_CREATED, context.getTenantId(), exception.getId().toString(),
            context.getPrincipalId(), exception.getEntityType() + ":" + exception.getEntityId());
        metrics.recordExceptionCreated();
        log.info("Validation exception created: id={}, tenant={}, entity={}:{}, rule={}",
            exception.getId(), context.getTenantId(), exception.getEntityType(), exception.getEntityId(),
            exception.getRuleId());

        return toResponse(exception, now);
    }

    @Transactional(readOnly = true)
    public List<ValidationExceptionResponse> listExceptions(boolean includeInactive) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        Instant now = clock.instant();
        return exceptionRepository.findByTenant(context.getTenantId(), includeInactive).stream()
            .map(exception -> toResponse(exception, now))
            .toList();
    }

    /**
     * Switch an exception off. Deactivating an inactive exception changes nothing.
     */
    public ValidationExceptionResponse deactivateException(UUID exceptionId) {
        SecurityContext context = securityContextProvider.getCurrentContext();
        securityKernel.authorizeAdministration(context, "exception.deactivate");

        ValidationExceptionRecord exception = exceptionRepository.findById(exceptionId)
            .orElseThrow(() -> ResourceNotFoundException.of("Validation exception", exceptionId));
        securityKernel.authorizeTenantAccess(context, exception.getTenantId(), "exception.deactivate");

        if (exception.isActive()) {
            exception.deactivate();
            exception = exceptionRepository.save(exception);
            auditService.record(AuditService.EXCEPTION_DEACTIVATED, exception.getTenantId(), exceptionId.toString(),
                context.getPrincipalId(), null);
            log.info("Validation exception deactivated: id={}, tenant={}", exceptionId, exception.getTenantId());
        }
        return toResponse(exception, clock.instant());
    }

    private static ValidationExceptionResponse toResponse(ValidationExceptionRecord exception, Instant now) {
        return ValidationExceptionResponse.builder()
            .id(exception.getId())
            .tenantId(exception.getTenantId())
            .entityType(exception.getEntityType())
            .entityId(exception.getEntityId())
            .ruleId(exception.getRuleId())
            .reason(exception.getReason())
            .createdBy(exception.getCreatedBy())
            .createdAt(exception.getCreatedAt())
            .expiresAt(exception.getExpiresAt())
            .isActive(exception.isActive())
            .isEffective(exception.isEffectiveAt(now))
            .build();
    }
}
