package com.archvalidation.interfaces.api.dto;

import com.archvalidation.domain.model.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationRunResponse {
    private UUID validationCycleId;
    private ExecutionStatus status;
    private String message;
    private ValidationCycleResponse cycle;
}
