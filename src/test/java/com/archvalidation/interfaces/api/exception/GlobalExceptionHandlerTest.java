package com.archvalidation.interfaces.api.exception;

import com.archvalidation.application.exception.CycleAlreadyRunningException;
import com.archvalidation.application.exception.InvalidRequestException;
import com.archvalidation.interfaces.api.dto.ErrorResponse;
import com.archvalidation.interfaces.api.dto.ErrorResponse.ErrorCode;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(Clock.fixed(NOW, ZoneOffset.UTC));
    private final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/validation/run");

    @Test
    void saturatedCyclePoolIsServiceUnavailable() {
        ResponseEntity<ErrorResponse> response =
            handler.handleUnavailable(new TaskRejectedException("queue full"), request);

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals(ErrorCode.SERVICE_UNAVAILABLE, response.getBody().getCode());
        assertFalse(response.getBody().getMessage().contains("queue full"));
    }

    @Test
    void unreachableDatastoreIsServiceUnavailable() {
        ResponseEntity<ErrorResponse> response =
            handler.handleUnavailable(new DataAccessResourceFailureException("connection refused"), request);

        assertEquals(503, response.getBody().getStatus());
    }

    @Test
    void invalidRequestIsUnprocessable() {
        ResponseEntity<ErrorResponse> response =
            handler.handleInvalidRequest(new InvalidRequestException("limit must be between 1 and 1000"), request);

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals(ErrorCode.INVALID_REQUEST, response.getBody().getCode());
        assertEquals("/validation/run", response.getBody().getPath());
        assertEquals(NOW, response.getBody().getTimestamp());
    }

    @Test
    void internalIllegalArgumentIsServerErrorWithSanitizedMessage() {
        ResponseEntity<ErrorResponse> response =
            handler.handleGenericException(new IllegalArgumentException("Failed to serialize map"), request);

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals(ErrorCode.INTERNAL_ERROR, response.getBody().getCode());
        assertFalse(response.getBody().getMessage().contains("serialize"));
    }

    @Test
    void runningCycleConflictNamesTheBlockingCycle() {
        UUID running = UUID.randomUUID();

        ResponseEntity<ErrorResponse> response = handler.handleCycleAlreadyRunning(
            new CycleAlreadyRunningException("tenant-a", running), request);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals(ErrorCode.CYCLE_ALREADY_RUNNING, response.getBody().getCode());
        assertEquals(running, response.getBody().getRunningCycleId());
        assertNull(response.getBody().getFieldErrors());
    }
}
