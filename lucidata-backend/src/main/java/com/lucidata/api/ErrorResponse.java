package com.lucidata.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * Error body for every non-2xx response.
 *
 * JSON fields (snake_case):
 * - code: machine-readable error code (VALIDATION_FAILED, SYNTAX_ERROR, ...)
 * - message: human-readable message
 * - details: optional extra detail
 * - trace_id: request correlation id, matches the X-Request-Id header
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {
    private String code;
    private String message;
    private String details;
    private String traceId;
}
