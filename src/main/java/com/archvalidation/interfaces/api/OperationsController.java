package com.archvalidation.interfaces.api;

import com.archvalidation.application.OperationsService;
import com.archvalidation.interfaces.api.dto.HealthResponse;
import com.archvalidation.interfaces.api.dto.MetricsResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated operational endpoints.
 */
@RestController
@RequestMapping("/validation")
@RequiredArgsConstructor
@Tag(name = "Operations", description = "Health and aggregate metrics")
public class OperationsController {

    private final OperationsService operationsService;

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Service health", description = "503 when the datastore is unreachable")
    public ResponseEntity<HealthResponse> health() {
        HealthResponse health = operationsService.health();
        HttpStatus status = OperationsService.STATUS_UP.equals(health.getStatus())
            ? HttpStatus.OK
            : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }

    @GetMapping(value = "/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Aggregate counters", description = "Service-wide totals; no tenant data")
    public MetricsResponse metrics() {
        return operationsService.metrics();
    }
}
