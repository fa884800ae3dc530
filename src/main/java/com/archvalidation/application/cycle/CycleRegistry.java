package com.archvalidation.application.cycle;

import com.archvalidation.application.exception.CycleAlreadyRunningException;
import com.archvalidation.config.ValidationProperties;
import com.archvalidation.domain.model.ValidationCycle;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight cycles of this process, keyed by cycle id.
 *
 * <p>At most one cycle per tenant can be registered at a time. Entries are
 * released by the worker when the cycle ends, whatever the outcome.
 */
@Component
@Slf4j
public class CycleRegistry {

    private final Map<UUID, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, UUID> cyclesByTenant = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ValidationProperties properties;

    public CycleRegistry(Clock clock, ValidationProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Register a new cycle and start its timeout.
     *
     * @throws CycleAlreadyRunningException if the tenant already has a registered cycle
     */
    public CancellationToken register(UUID cycleId, String tenantId) {
        UUID existing = cyclesByTenant.putIfAbsent(tenantId, cycleId);
        if (existing != null) {
            throw new CycleAlreadyRunningException(tenantId, existing);
        }
        CancellationToken token = new CancellationToken(cycleId, tenantId, clock, properties.getCycle().getTimeout());
        tokens.put(cycleId, token);
        log.debug("Cycle registered: cycle={}, tenant={}, deadline={}", cycleId, tenantId, token.getDeadline());
        return token;
    }

    public Optional<CancellationToken> find(UUID cycleId) {
        return Optional.ofNullable(tokens.get(cycleId));
    }

    public boolean isRegistered(UUID cycleId) {
        return tokens.containsKey(cycleId);
    }

    /**
     * Signal cancellation to a registered cycle.
     *
     * @return false if the cycle is not running in this process
     */
    public boolean cancel(UUID cycleId, String requestedBy) {
        CancellationToken token = tokens.get(cycleId);
        if (token == null) {
            return false;
        }
        token.cancel(requestedBy);
        log.info("Cancellation requested: cycle={}, tenant={}, by={}", cycleId, token.getTenantId(), requestedBy);
        return true;
    }

    public void release(UUID cycleId) {
        CancellationToken token = tokens.remove(cycleId);
        if (token != null) {
            cyclesByTenant.remove(token.getTenantId(), cycleId);
        }
    }

    public int size() {
        return tokens.size();
    }

    @PreDestroy
    public void cancelAll() {
        if (!tokens.isEmpty()) {
            log.warn("Shutting down with {} running validation cycle(s); cancelling", tokens.size());
        }
        tokens.values().forEach(token -> token.cancel(ValidationCycle.SYSTEM_TRIGGER));
    }
}
