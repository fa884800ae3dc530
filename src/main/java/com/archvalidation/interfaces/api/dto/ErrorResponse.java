package com.archvalidation.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Error body of every non-2xx response.
 *
 * {@code code} is stable for clients to branch on; {@code error} and {@code message} are for people.
 * Optional members are left out of the JSON when they do not apply.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private UUID requestId;
    private Instant timestamp;
    private Integer status;
    private ErrorCode code;
    private String error;
    private String message;
    private String path;

    /** The cycle holding the tenant's slot, on {@link ErrorCode#CYCLE_ALREADY_RUNNING}. */
    private UUID runningCycleId;

    private List<FieldViolation> fieldErrors;

    public enum ErrorCode {
        UNAUTHENTICATED,
        ACCESS_DENIED,
        NOT_FOUND,
        DUPLICATE_RESOURCE,
        CYCLE_ALREADY_RUNNING,
        INVALID_STATE,
        CONCURRENT_MODIFICATION,
        VALIDATION_FAILED,
        INVALID_RULE_LOGIC,
        INVALID_REQUEST,
        SERVICE_UNAVAILABLE,
        INTERNAL_ERROR;

        @JsonValue
        public String getValue() {
            return name().toLowerCase();
        }
    }

    /**
     * One rejected body field or query parameter.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FieldViolation {
        private String field;
        /** Name of the failed constraint, e.g. {@code NotBlank} or {@code Max}. */
        private String constraint;
        private String message;
        private Object rejectedValue;
    }
}
