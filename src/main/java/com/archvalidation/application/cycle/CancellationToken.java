package com.archvalidation.application.cycle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Cooperative stop signal of one running cycle.
 *
 * <p>The worker calls {@link #checkpoint()} between units of work; any other
 * thread may call {@link #cancel(String)}. The deadline is fixed when the token is
 * created.
 */
public final class CancellationToken {

    private final UUID cycleId;
    private final String tenantId;
    private final Clock clock;
    private final Duration timeout;
    private final Instant deadline;
    private volatile boolean cancelled;
    private volatile String cancelledBy;

    CancellationToken(UUID cycleId, String tenantId, Clock clock, Duration timeout) {
        this.cycleId = cycleId;
        this.tenantId = tenantId;
        this.clock = clock;
        this.timeout = timeout;
        this.deadline = clock.instant().plus(timeout);
    }

    public UUID getCycleId() {
        return cycleId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public void cancel(String requestedBy) {
        this.cancelledBy = requestedBy;
        this.cancelled = true;
    }

    /**
     * User id of whoever asked for cancellation, or {@code system} on shutdown.
     */
    public String getCancelledBy() {
        return cancelledBy;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    /**
     * @throws CycleCancelledException if cancellation was requested
     * @throws CycleTimeoutException if the deadline has passed
     */
    public void checkpoint() {
        if (cancelled) {
            throw new CycleCancelledException(cycleId);
        }
        if (isExpired()) {
            throw new CycleTimeoutException(cycleId, timeout);
        }
    }
}
