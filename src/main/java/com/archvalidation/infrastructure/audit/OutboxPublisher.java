package com.archvalidation.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Drains the outbox in id order. Publishing is a structured log line; a
 * broker client would plug in here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {
    private final OutboxEventRepository repository;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${validation.outbox.publish-interval:10000}")
    @Transactional
    public void publish() {
        int published = publishPending();
        if (published > 0) {
            log.debug("Outbox drained: published={}", published);
        }
    }

    /**
     * Publish one batch of pending events.
     *
     * @return number of events published
     */
    @Transactional
    public int publishPending() {
        List<OutboxEvent> pending = repository.findTop100ByProcessedFalseOrderByIdAsc();
        Instant now = Instant.now(clock);
        for (OutboxEvent e : pending) {
            if (log.isInfoEnabled()) {
                log.info("OUTBOX publish event={} tenant={} resourceId={} principal={} detail={} createdAt={}",
                        e.getEventType(), e.getTenantId(), e.getResourceId(), e.getPrincipalId(),
                        e.getDetail(), e.getCreatedAt());
            }
            e.setProcessed(true);
            e.setProcessedAt(now);
        }
        repository.saveAll(pending);
        return pending.size();
    }
}
