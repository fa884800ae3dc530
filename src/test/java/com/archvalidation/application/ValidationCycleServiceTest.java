package com.archvalidation.application;

import com.archvalidation.application.cycle.CancellationToken;
import com.archvalidation.application.cycle.CycleCancelledException;
import com.archvalidation.application.cycle.CycleRegistry;
import com.archvalidation.application.cycle.CycleStateRecorder;
import com.archvalidation.application.cycle.CycleTimeoutException;
import com.archvalidation.application.cycle.ValidationCycleRunner;
import com.archvalidation.application.exception.CycleAlreadyRunningException;
import com.archvalidation.application.exception.ResourceNotFoundException;
import com.archvalidation.config.PerformanceConfiguration.ValidationMetrics;
import com.archvalidation.config.ValidationProperties;
import com.archvalidation.domain.model.ExecutionStatus;
import com.archvalidation.domain.model.ValidationCycle;
import com.archvalidation.domain.repository.ValidationCycleRepository;
import com.archvalidation.infrastructure.security.Role;
import com.archvalidation.infrastructure.security.SecurityContext;
import com.archvalidation.infrastructure.security.TrustedSecurityKernel;
import com.archvalidation.interfaces.api.dto.RunValidationRequest;
import com.archvalidation.interfaces.api.dto.ValidationCycleResponse;
import com.archvalidation.interfaces.api.dto.ValidationRunResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ValidationCycleServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final String TENANT = "tenant-a";

    @Mock
    private ValidationCycleRepository cycleRepository;
    @Mock
    private ValidationCycleRunner cycleRunner;
    @Mock
    private CycleStateRecorder stateRecorder;
    @Mock
    private SecurityContextProvider securityContextProvider;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ValidationProperties properties;
    private CycleRegistry registry;
    private ValidationCycle running;

    @BeforeEach
    void setUp() {
        properties = new ValidationProperties();
        registry = new CycleRegistry(Clock.fixed(NOW, ZoneOffset.UTC), properties);
        running = ValidationCycle.start(TENANT, "admin-1", null, NOW);
    }

    private ValidationCycleService service(TaskExecutor executor) {
        return new ValidationCycleService(cycleRepository, cycleRunner, stateRecorder, registry,
            new TrustedSecurityKernel(), securityContextProvider, new ValidationMetrics(meterRegistry),
            properties, executor);
    }

    private void callerIs(Role role) {
        when(securityContextProvider.getCurrentContext()).thenReturn(SecurityContext.builder()
            .requestId(UUID.randomUUID())
            .principalId("admin-1")
            .tenantId(TENANT)
            .role(role)
            .requestedAt(NOW)
            .build());
    }

    private void opensCycle(String ruleSetId) {
        when(stateRecorder.open(any(UUID.class), eq(TENANT), eq("admin-1"), eq(ruleSetId)))
            .thenAnswer(invocation -> {
                running = ValidationCycle.start(invocation.getArgument(0), TENANT, "admin-1", ruleSetId, NOW);
                return running;
            });
    }

    private static ValidationCycle ended(ExecutionStatus status) {
        ValidationCycle cycle = ValidationCycle.start(TENANT, "admin-1", null, NOW);
        switch (status) {
            case COMPLETED -> cycle.complete(new ValidationCycle.CycleStatistics(0, 0, 0, 0), 1.0, NOW);
            case FAILED -> cycle.fail("failed", NOW);
            case CANCELLED -> cycle.cancel(NOW);
            default -> { }
        }
        return cycle;
    }

    @Nested
    @DisplayName("starting a cycle")
    class Start {

        @Test
        void asynchronousStartReturnsRunningCycleAndReleasesWorker() {
            callerIs(Role.ADMIN);
            opensCycle("baseline");
            when(cycleRunner.run(any(), any())).thenReturn(ended(ExecutionStatus.COMPLETED));

            ValidationRunResponse response = service(new SyncTaskExecutor())
                .startCycle(new RunValidationRequest("baseline"));

            assertEquals(running.getId(), response.getValidationCycleId());
            assertEquals(ExecutionStatus.RUNNING, response.getStatus());
            assertEquals(0, registry.size());
            assertEquals(1.0, meterRegistry.counter("validation.cycles.started").count());
        }

        @Test
        void viewerCannotStartCycle() {
            callerIs(Role.VIEWER);

            assertThrows(TrustedSecurityKernel.AccessDeniedException.class,
                () -> service(new SyncTaskExecutor()).startCycle(null));
            verifyNoInteractions(stateRecorder, cycleRunner);
        }

        @Test
        void rejectedSubmissionFailsTheCycle() {
            callerIs(Role.OWNER);
            opensCycle(null);
            TaskExecutor full = task -> {
                throw new TaskRejectedException("queue full");
            };

            assertThrows(TaskRejectedException.class, () -> service(full).startCycle(null));

            verify(stateRecorder).markFailed(running.getId(), "Validation queue is full");
            assertFalse(registry.isRegistered(running.getId()));
        }

        @Test
        void secondStartWhileRunningWritesNoCycleRow() {
            callerIs(Role.ADMIN);
            UUID inFlight = UUID.randomUUID();
            registry.register(inFlight, TENANT);

            CycleAlreadyRunningException ex = assertThrows(CycleAlreadyRunningException.class,
                () -> service(new SyncTaskExecutor()).startCycle(null));

            assertEquals(inFlight, ex.getRunningCycleId());
            verifyNoInteractions(stateRecorder, cycleRunner);
            assertTrue(registry.isRegistered(inFlight));
        }

        @Test
        void cycleRunningOnAnotherInstanceReleasesTheLocalSlot() {
            callerIs(Role.ADMIN);
            UUID elsewhere = UUID.randomUUID();
            when(stateRecorder.open(any(UUID.class), eq(TENANT), eq("admin-1"), isNull()))
                .thenThrow(new CycleAlreadyRunningException(TENANT, elsewhere));

            assertThrows(CycleAlreadyRunningException.class,
                () -> service(new SyncTaskExecutor()).startCycle(null));

            assertEquals(0, registry.size());
            verify(stateRecorder, never()).markFailed(any(), any());
            verifyNoInteractions(cycleRunner);
        }
    }

    @Nested
    @DisplayName("cycle outcomes")
    class Outcomes {

        @BeforeEach
        void synchronous() {
            properties.getCycle().setSynchronous(true);
            callerIs(Role.ADMIN);
            opensCycle(null);
        }

        @Test
        void completedCycleIsReturnedInTerminalState() {
            ValidationCycle completed = ended(ExecutionStatus.COMPLETED);
            when(cycleRunner.run(any(), any())).thenReturn(completed);

            ValidationRunResponse response = service(new SyncTaskExecutor()).startCycle(null);

            assertEquals(ExecutionStatus.COMPLETED, response.getStatus());
            assertEquals(1.0, response.getCycle().getMaturityScore());
        }

        @Test
        void timeoutEndsFailed() {
            when(cycleRunner.run(any(), any()))
                .thenThrow(new CycleTimeoutException(UUID.randomUUID(), Duration.ofMinutes(5)));
            when(stateRecorder.markFailed(any(), startsWith("Timed out: ")))
                .thenReturn(Optional.of(ended(ExecutionStatus.FAILED)));

            ValidationRunResponse response = service(new SyncTaskExecutor()).startCycle(null);

            assertEquals(ExecutionStatus.FAILED, response.getStatus());
            assertEquals(1.0, meterRegistry.counter("validation.cycles.failed", "reason", "timeout").count());
            assertEquals(0, registry.size());
        }

        @Test
        void cancellationEndsCancelled() {
            when(cycleRunner.run(any(), any()))
                .thenThrow(new CycleCancelledException(UUID.randomUUID()));
            when(stateRecorder.markCancelled(any(), any()))
                .thenReturn(Optional.of(ended(ExecutionStatus.CANCELLED)));

            ValidationRunResponse response = service(new SyncTaskExecutor()).startCycle(null);

            assertEquals(ExecutionStatus.CANCELLED, response.getStatus());
            assertEquals(1.0, meterRegistry.counter("validation.cycles.cancelled").count());
        }

        @Test
        void unexpectedErrorEndsFailedWithSanitizedReason() {
            when(cycleRunner.run(any(), any()))
                .thenThrow(new IllegalArgumentException("secret detail"));
            when(stateRecorder.markFailed(any(), eq("Evaluation failed: IllegalArgumentException")))
                .thenReturn(Optional.of(ended(ExecutionStatus.FAILED)));

            ValidationRunResponse response = service(new SyncTaskExecutor()).startCycle(null);

            assertEquals(ExecutionStatus.FAILED, response.getStatus());
            assertEquals(0, registry.size());
        }
    }

    @Nested
    @DisplayName("cancelling a cycle")
    class Cancel {

        @Test
        void finishedCycleCannotBeCancelled() {
            callerIs(Role.ADMIN);
            ValidationCycle completed = ended(ExecutionStatus.COMPLETED);
            when(cycleRepository.findByIdAndTenant(completed.getId(), TENANT)).thenReturn(Optional.of(completed));

            assertThrows(IllegalStateException.class, () -> service(new SyncTaskExecutor()).cancelCycle(completed.getId()));
        }

        @Test
        void runningCycleWithoutLocalWorkerIsMarkedCancelled() {
            callerIs(Role.ADMIN);
            when(cycleRepository.findByIdAndTenant(running.getId(), TENANT)).thenReturn(Optional.of(running));
            when(stateRecorder.markCancelled(running.getId(), "admin-1"))
                .thenReturn(Optional.of(ended(ExecutionStatus.CANCELLED)));

            ValidationCycleResponse response = service(new SyncTaskExecutor()).cancelCycle(running.getId());

            assertEquals(ExecutionStatus.CANCELLED, response.getExecutionStatus());
        }

        @Test
        void runningLocalCycleIsSignalled() {
            callerIs(Role.ADMIN);
            CancellationToken token = registry.register(running.getId(), TENANT);
            when(cycleRepository.findByIdAndTenant(running.getId(), TENANT)).thenReturn(Optional.of(running));
            when(cycleRepository.findById(running.getId())).thenReturn(Optional.of(running));

            service(new SyncTaskExecutor()).cancelCycle(running.getId());

            assertTrue(token.isCancelled());
            verify(stateRecorder, never()).markCancelled(any(), any());
        }

        @Test
        void unknownCycleIsNotFound() {
            callerIs(Role.ADMIN);
            UUID unknown = UUID.randomUUID();
            when(cycleRepository.findByIdAndTenant(unknown, TENANT)).thenReturn(Optional.empty());

            assertThrows(ResourceNotFoundException.class,
                () -> service(new SyncTaskExecutor()).cancelCycle(unknown));
        }
    }
}
