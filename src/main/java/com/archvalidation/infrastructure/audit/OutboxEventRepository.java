package com.archvalidation.infrastructure.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, Long> {

    List<OutboxEvent> findTop100ByProcessedFalseOrderByIdAsc();

    List<OutboxEvent> findByTenantIdOrderByIdAsc(String tenantId);

    long countByProcessedFalse();
}
