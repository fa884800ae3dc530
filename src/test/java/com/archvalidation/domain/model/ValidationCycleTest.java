package com.archvalidation.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ValidationCycleTest {

    private static final Instant START = Instant.parse("2024-06-01T12:00:00Z");
    private static final Instant END = START.plusSeconds(5);

    @Test
    void startsRunningWithSystemTriggerByDefault() {
        ValidationCycle cycle = ValidationCycle.start("tenant-a", null, "baseline", START);

        assertTrue(cycle.isRunning());
        assertEquals(ExecutionStatus.RUNNING, cycle.getExecutionStatus());
        assertEquals(ValidationCycle.SYSTEM_TRIGGER, cycle.getTriggeredBy());
        assertEquals("baseline", cycle.getRuleSetId());
        assertNull(cycle.getMaturityScore());
    }

    @Test
    void completeRecordsStatistics() {
        ValidationCycle cycle = ValidationCycle.start("tenant-a", "u1", null, START);

        cycle.complete(new ValidationCycle.CycleStatistics(3, 1, 4, 10), 0.75, END);

        assertEquals(ExecutionStatus.COMPLETED, cycle.getExecutionStatus());
        assertEquals(3, cycle.getTotalIssuesFound());
        assertEquals(1, cycle.getSuppressedIssues());
        assertEquals(0.75, cycle.getMaturityScore());
        assertEquals(END, cycle.getEndTime());
    }

    @Test
    void terminalStatesAreFinal() {
        ValidationCycle failed = ValidationCycle.start("tenant-a", "u1", null, START);
        failed.fail("boom", END);
        ValidationCycle cancelled = ValidationCycle.start("tenant-a", "u1", null, START);
        cancelled.cancel(END);

        assertEquals("boom", failed.getFailureReason());
        assertEquals(ExecutionStatus.CANCELLED, cancelled.getExecutionStatus());
        assertThrows(IllegalStateException.class, () -> failed.cancel(END));
        assertThrows(IllegalStateException.class,
            () -> cancelled.complete(new ValidationCycle.CycleStatistics(0, 0, 0, 0), 1.0, END));
    }

    @Test
    void rejectsMaturityOutsideUnitInterval() {
        ValidationCycle cycle = ValidationCycle.start("tenant-a", "u1", null, START);

        assertThrows(IllegalArgumentException.class,
            () -> cycle.complete(new ValidationCycle.CycleStatistics(0, 0, 0, 0), 1.5, END));
        assertTrue(cycle.isRunning());
    }
}
