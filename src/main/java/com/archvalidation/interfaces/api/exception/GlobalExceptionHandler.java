package com.archvalidation.interfaces.api.exception;

import com.archvalidation.application.exception.CycleAlreadyRunningException;
import com.archvalidation.application.exception.DuplicateResourceException;
import com.archvalidation.application.exception.InvalidRequestException;
import com.archvalidation.application.exception.ResourceNotFoundException;
import com.archvalidation.domain.rules.InvalidRuleLogicException;
import com.archvalidation.infrastructure.security.TrustedSecurityKernel;
import com.archvalidation.interfaces.api.dto.ErrorResponse;
import com.archvalidation.interfaces.api.dto.ErrorResponse.ErrorCode;
import com.archvalidation.interfaces.api.dto.ErrorResponse.FieldViolation;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Maps exceptions to the standard error body:
 * - 401 missing or invalid credentials
 * - 403 role or tenant denials from the SecurityKernel
 * - 404 unknown resources
 * - 409 duplicates, a running cycle and illegal state transitions
 * - 422 invalid input, including unreadable rule logic and {@link InvalidRequestException}
 * - 503 datastore or worker pool unavailable
 * - 500 everything else, with a sanitized message
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<FieldViolation> fieldErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> {
                String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();
                Object rejectedValue = error instanceof FieldError
                    ? ((FieldError) error).getRejectedValue()
                    : null;

                return FieldViolation.builder()
                    .field(fieldName)
                    .constraint(error.getCode())
                    .message(error.getDefaultMessage())
                    .rejectedValue(rejectedValue)
                    .build();
            })
            .collect(Collectors.toList());

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                fieldErrors.size(), request.getRequestURI());
        }

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCode.VALIDATION_FAILED, "Validation Failed",
            "Invalid request parameters", request, fieldErrors);
    }

    /**
     * Handle constraint violations on query and path parameters.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            HttpServletRequest request) {

        List<FieldViolation> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(violation -> FieldViolation.builder()
                .field(lastNode(violation.getPropertyPath().toString()))
                .constraint(violation.getConstraintDescriptor().getAnnotation().annotationType().getSimpleName())
                .message(violation.getMessage())
                .rejectedValue(violation.getInvalidValue())
                .build())
            .collect(Collectors.toList());

        log.warn("Constraint violation: {} failures on {}", fieldErrors.size(), request.getRequestURI());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCode.VALIDATION_FAILED, "Validation Failed",
            "Invalid request parameters", request, fieldErrors);
    }

    /**
     * Handle unreadable bodies, unknown enum values and malformed parameters.
     */
    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleUnreadableInput(
            Exception ex,
            HttpServletRequest request) {

        String message = ex instanceof MethodArgumentTypeMismatchException
            ? "Invalid value for parameter '" + ((MethodArgumentTypeMismatchException) ex).getName() + "'"
            : ex instanceof MissingServletRequestParameterException
                ? ex.getMessage()
                : "Malformed request body";

        log.warn("Unreadable input on {}: {}", request.getRequestURI(), ex.getMessage());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCode.VALIDATION_FAILED, "Validation Failed", message,
            request, null);
    }

    @ExceptionHandler(InvalidRuleLogicException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRuleLogic(
            InvalidRuleLogicException ex,
            HttpServletRequest request) {

        log.warn("Invalid rule logic on {}: {}", request.getRequestURI(), ex.getMessage());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCode.INVALID_RULE_LOGIC, "Invalid Rule Logic",
            ex.getMessage(), request, null);
    }

    /**
     * Handle request content rejected by the services.
     */
    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(
            InvalidRequestException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Invalid request: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCode.INVALID_REQUEST, "Unprocessable Entity",
            "Invalid request: " + ex.getMessage(), request, null);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            ResourceNotFoundException ex,
            HttpServletRequest request) {

        log.debug("Not found: {} on {}", ex.getMessage(), request.getRequestURI());

        return respond(HttpStatus.NOT_FOUND, ErrorCode.NOT_FOUND, "Not Found", ex.getMessage(), request, null);
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(
            DuplicateResourceException ex,
            HttpServletRequest request) {

        log.warn("Duplicate resource: {} on {}", ex.getMessage(), request.getRequestURI());

        return respond(HttpStatus.CONFLICT, ErrorCode.DUPLICATE_RESOURCE, "Conflict", ex.getMessage(), request, null);
    }

    @ExceptionHandler(CycleAlreadyRunningException.class)
    public ResponseEntity<ErrorResponse> handleCycleAlreadyRunning(
            CycleAlreadyRunningException ex,
            HttpServletRequest request) {

        log.warn("Cycle rejected on {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse body = body(HttpStatus.CONFLICT, ErrorCode.CYCLE_ALREADY_RUNNING, "Cycle Already Running",
            ex.getMessage(), request, null);
        body.setRunningCycleId(ex.getRunningCycleId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    /**
     * Handle illegal state exceptions: a finished cycle, a terminal transition.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Illegal state: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return respond(HttpStatus.CONFLICT, ErrorCode.INVALID_STATE, "Invalid State", ex.getMessage(), request, null);
    }

    /**
     * Handle optimistic locking failures.
     */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(
            ObjectOptimisticLockingFailureException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Optimistic lock exception on {}", request.getRequestURI());
        }

        return respond(HttpStatus.CONFLICT, ErrorCode.CONCURRENT_MODIFICATION, "Concurrent Modification",
            "The resource was modified by another request. Please retry.", request, null);
    }

    /**
     * Handle access denied exceptions from SecurityKernel.
     */
    @ExceptionHandler(TrustedSecurityKernel.AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            TrustedSecurityKernel.AccessDeniedException ex,
            HttpServletRequest request) {

        if (log.isWarnEnabled()) {
            log.warn("Access denied: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return respond(HttpStatus.FORBIDDEN, ErrorCode.ACCESS_DENIED, "Access Denied", ex.getMessage(), request, null);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(
            AuthenticationException ex,
            HttpServletRequest request) {

        log.warn("Unauthenticated request on {}: {}", request.getRequestURI(), ex.getMessage());

        return respond(HttpStatus.UNAUTHORIZED, ErrorCode.UNAUTHENTICATED, "Unauthorized", "Authentication required",
            request, null);
    }

    /**
     * Handle an unreachable datastore or a saturated cycle pool.
     */
    @ExceptionHandler({
        DataAccessResourceFailureException.class,
        CannotCreateTransactionException.class,
        TaskRejectedException.class
    })
    public ResponseEntity<ErrorResponse> handleUnavailable(
            Exception ex,
            HttpServletRequest request) {

        log.error("Service unavailable on {}: {}", request.getRequestURI(), ex.getMessage());

        return respond(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.SERVICE_UNAVAILABLE, "Service Unavailable",
            "The service is temporarily unavailable. Please retry later.", request, null);
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                request.getRequestURI(), ex.getMessage(), ex);
        }

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR, "Internal Server Error",
            "An unexpected error occurred. Please contact support.", request, null);
    }

    private ResponseEntity<ErrorResponse> respond(
            HttpStatus status,
            ErrorCode code,
            String error,
            String message,
            HttpServletRequest request,
            List<FieldViolation> fieldErrors) {

        return ResponseEntity.status(status).body(body(status, code, error, message, request, fieldErrors));
    }

    private ErrorResponse body(
            HttpStatus status,
            ErrorCode code,
            String error,
            String message,
            HttpServletRequest request,
            List<FieldViolation> fieldErrors) {

        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(clock.instant())
            .status(status.value())
            .code(code)
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .fieldErrors(fieldErrors)
            .build();
    }

    private static String lastNode(String propertyPath) {
        int dot = propertyPath.lastIndexOf('.');
        return dot >= 0 ? propertyPath.substring(dot + 1) : propertyPath;
    }
}
