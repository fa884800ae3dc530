package com.archvalidation.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultAuditService implements AuditService {

    private static final int MAX_DETAIL = 2000;

    private final OutboxEventRepository outbox;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(String eventType, String tenantId, String resourceId, String principalId, String detail) {
        log.info("AUDIT event={} tenant={} resourceId={} principal={} detail={}",
                eventType, tenantId, resourceId, principalId, detail);
        try {
            OutboxEvent evt = OutboxEvent.builder()
                    .eventType(eventType)
                    .tenantId(tenantId)
                    .resourceId(resourceId)
                    .principalId(principalId != null ? principalId : "system")
                    .detail(truncate(detail))
                    .createdAt(Instant.now(clock))
                    .processed(false)
                    .build();
            outbox.save(evt);
        } catch (RuntimeException e) {
            // audit persistence is best-effort
            log.warn("Outbox write failed for event={} resourceId={}: {}", eventType, resourceId, e.getMessage());
        }
    }

    private static String truncate(String detail) {
        if (detail == null) {
            return "";
        }
        return detail.length() > MAX_DETAIL ? detail.substring(0, MAX_DETAIL) : detail;
    }
}
