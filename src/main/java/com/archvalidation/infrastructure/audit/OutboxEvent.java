package com.archvalidation.infrastructure.audit;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "outbox_events", indexes = {
    @Index(name = "idx_outbox_events_processed", columnList = "processed, id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OutboxEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, name = "event_type")
    private String eventType;

    @Column(name = "tenant_id")
    private String tenantId;

    @Column(nullable = false, name = "resource_id")
    private String resourceId;

    @Column(nullable = false, name = "principal_id")
    private String principalId;

    @Column(nullable = false, length = 2000)
    private String detail;

    @Column(nullable = false, name = "created_at")
    private Instant createdAt;

    @Column(nullable = false)
    private boolean processed;

    @Column(name = "processed_at")
    private Instant processedAt;
}
