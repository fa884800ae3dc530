package com.archvalidation.application.cycle;

import com.archvalidation.application.exception.CycleAlreadyRunningException;
import com.archvalidation.config.ValidationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CycleRegistryTest {

    private MutableClock clock;
    private CycleRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        ValidationProperties properties = new ValidationProperties();
        properties.getCycle().setTimeout(Duration.ofMinutes(5));
        registry = new CycleRegistry(clock, properties);
    }

    @Test
    void oneCyclePerTenant() {
        UUID first = UUID.randomUUID();
        registry.register(first, "t1");

        CycleAlreadyRunningException e = assertThrows(CycleAlreadyRunningException.class,
            () -> registry.register(UUID.randomUUID(), "t1"));
        assertEquals(first, e.getRunningCycleId());
        assertDoesNotThrow(() -> registry.register(UUID.randomUUID(), "t2"));
        assertEquals(2, registry.size());
    }

    @Test
    void releaseFreesTheTenant() {
        UUID cycleId = UUID.randomUUID();
        registry.register(cycleId, "t1");

        registry.release(cycleId);

        assertFalse(registry.isRegistered(cycleId));
        assertDoesNotThrow(() -> registry.register(UUID.randomUUID(), "t1"));
    }

    @Test
    void cancelSignalsTheToken() {
        UUID cycleId = UUID.randomUUID();
        CancellationToken token = registry.register(cycleId, "t1");

        assertTrue(registry.cancel(cycleId, "admin-1"));

        assertTrue(token.isCancelled());
        assertEquals("admin-1", token.getCancelledBy());
        assertThrows(CycleCancelledException.class, token::checkpoint);
        assertFalse(registry.cancel(UUID.randomUUID(), "admin-1"));
    }

    @Test
    void checkpointFailsOnceTheDeadlinePasses() {
        CancellationToken token = registry.register(UUID.randomUUID(), "t1");

        assertDoesNotThrow(token::checkpoint);
        clock.advance(Duration.ofMinutes(5));

        assertTrue(token.isExpired());
        assertThrows(CycleTimeoutException.class, token::checkpoint);
    }

    @Test
    void cancelAllStopsEveryCycle() {
        CancellationToken a = registry.register(UUID.randomUUID(), "t1");
        CancellationToken b = registry.register(UUID.randomUUID(), "t2");

        registry.cancelAll();

        assertTrue(a.isCancelled());
        assertTrue(b.isCancelled());
        assertEquals("system", a.getCancelledBy());
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
