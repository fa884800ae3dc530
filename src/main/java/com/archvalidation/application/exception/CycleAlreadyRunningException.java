package com.archvalidation.application.exception;

import java.util.UUID;

/**
 * Thrown when a tenant starts a cycle while another one is still running.
 */
public class CycleAlreadyRunningException extends IllegalStateException {

    private final UUID runningCycleId;

    public CycleAlreadyRunningException(String tenantId, UUID runningCycleId) {
        super("A validation cycle is already running for tenant " + tenantId
            + (runningCycleId != null ? ": " + runningCycleId : ""));
        this.runningCycleId = runningCycleId;
    }

    public UUID getRunningCycleId() {
        return runningCycleId;
    }
}
