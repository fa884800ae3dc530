package com.archvalidation.application;

import com.archvalidation.application.exception.InvalidRequestException;
import com.archvalidation.application.exception.ResourceNotFoundException;
import com.archvalidation.config.ValidationProperties;
import com.archvalidation.domain.model.IssueType;
import com.archvalidation.domain.model.Severity;
import com.archvalidation.domain.model.ValidationIssue;
import com.archvalidation.domain.repository.IssueQuery;
import com.archvalidation.domain.repository.ValidationIssueRepository;
import com.archvalidation.infrastructure.audit.AuditService;
import com.archvalidation.infrastructure.security.Role;
import com.archvalidation.infrastructure.security.SecurityContext;
import com.archvalidation.infrastructure.security.TrustedSecurityKernel;
import com.archvalidation.interfaces.api.dto.IssuesListResponse;
import com.archvalidation.interfaces.api.dto.ValidationIssueResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IssueServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private ValidationIssueRepository issueRepository;
    @Mock
    private SecurityContextProvider securityContextProvider;
    @Mock
    private AuditService auditService;

    private IssueService service;

    @BeforeEach
    void setUp() {
        service = new IssueService(issueRepository, new TrustedSecurityKernel(), securityContextProvider,
            auditService, new ValidationProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        when(securityContextProvider.getCurrentContext()).thenReturn(SecurityContext.builder()
            .requestId(UUID.randomUUID())
            .principalId("user-1")
            .tenantId("tenant-a")
            .role(Role.VIEWER)
            .requestedAt(NOW)
            .build());
    }

    private static ValidationIssue issue(String tenant) {
        return ValidationIssue.builder()
            .tenantId(tenant)
            .entityType("goal")
            .entityId("G1")
            .issueType(IssueType.MISSING_LINK)
            .severity(Severity.HIGH)
            .description("gap")
            .detectedAt(NOW.minusSeconds(3600))
            .build();
    }

    @Test
    void resolvingTwiceKeepsFirstResolution() {
        ValidationIssue issue = issue("tenant-a");
        when(issueRepository.findById(issue.getId())).thenReturn(Optional.of(issue));
        when(issueRepository.save(issue)).thenReturn(issue);

        ValidationIssueResponse first = service.resolveIssue(issue.getId());
        ValidationIssueResponse second = service.resolveIssue(issue.getId());

        assertTrue(first.getIsResolved());
        assertEquals(NOW, first.getResolvedAt());
        assertEquals(first.getResolvedAt(), second.getResolvedAt());
        assertEquals("user-1", second.getResolvedBy());
        verify(issueRepository, times(1)).save(issue);
        verify(auditService, times(1)).record(eq(AuditService.ISSUE_RESOLVED), eq("tenant-a"),
            eq(issue.getId().toString()), eq("user-1"), any());
    }

    @Test
    void issueOfAnotherTenantIsForbidden() {
        ValidationIssue foreign = issue("tenant-b");
        when(issueRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThrows(TrustedSecurityKernel.AccessDeniedException.class, () -> service.resolveIssue(foreign.getId()));
        assertFalse(foreign.isResolved());
        verify(issueRepository, never()).save(any());
    }

    @Test
    void unknownIssueIsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(issueRepository.findById(unknown)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.resolveIssue(unknown));
        verify(auditService, never()).record(anyString(), anyString(), anyString(), anyString(), any());
    }

    @Test
    void listIsScopedToCallerTenantWithSeverityCounts() {
        ValidationIssue issue = issue("tenant-a");
        IssueQuery expected = new IssueQuery("tenant-a", null, Severity.HIGH, false, 0, 10);
        when(issueRepository.find(expected)).thenReturn(List.of(issue));
        when(issueRepository.count(expected)).thenReturn(1L);
        when(issueRepository.countBySeverity("tenant-a")).thenReturn(Map.of(Severity.HIGH, 1L, Severity.LOW, 4L));

        IssuesListResponse response = service.listIssues(0, 10, null, Severity.HIGH, false);

        assertEquals(1, response.getIssues().size());
        assertEquals(1L, response.getTotalCount());
        assertEquals(1L, response.getHighCount());
        assertEquals(4L, response.getLowCount());
        assertEquals(0L, response.getCriticalCount());
    }

    @Test
    void limitAboveMaximumIsRejected() {
        assertThrows(InvalidRequestException.class, () -> service.listIssues(0, 1001, null, null, null));
        verifyNoInteractions(issueRepository);
    }
}
