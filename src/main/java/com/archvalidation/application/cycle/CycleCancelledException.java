package com.archvalidation.application.cycle;

import java.util.UUID;

/**
 * Raised at a checkpoint once cancellation of the cycle was requested.
 */
public class CycleCancelledException extends RuntimeException {

    public CycleCancelledException(UUID cycleId) {
        super("Validation cycle " + cycleId + " was cancelled");
    }
}
