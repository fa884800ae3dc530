package com.archvalidation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class of the Architecture Validation service.
 *
 * <p>Evaluates each tenant's architecture model against a global rule set
 * and reports:
 *
 * <ul>
 *   <li><strong>Issues</strong>: missing links, orphaned and stale elements, incomplete fields</li>
 *   <li><strong>Scorecards</strong>: completeness, traceability and alignment per layer</li>
 *   <li><strong>Traceability matrix</strong>: connection strength between element types</li>
 *   <li><strong>History</strong>: maturity score over past cycles</li>
 * </ul>
 *
 * <p><strong>Architecture:</strong>
 * <ul>
 *   <li>Hexagonal architecture (ports and adapters)</li>
 *   <li>Framework-free rule engine in {@code domain.rules}</li>
 *   <li>Transactional outbox for audit events</li>
 * </ul>
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableScheduling
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class ArchitectureValidationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArchitectureValidationApplication.class, args);
        log.info("Architecture Validation service started");
    }
}
