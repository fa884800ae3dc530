package com.archvalidation.application.cycle;

import java.time.Duration;
import java.util.UUID;

/**
 * Raised at a checkpoint once the cycle has run past its deadline.
 */
public class CycleTimeoutException extends RuntimeException {

    public CycleTimeoutException(UUID cycleId, Duration timeout) {
        super("Validation cycle " + cycleId + " exceeded the timeout of " + timeout.toSeconds() + "s");
    }
}
