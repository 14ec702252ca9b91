package com.lucidata.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for natural-language to SQL translation.
 *
 * JSON fields (snake_case):
 * - query: natural-language question
 * - model: optional model override
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProcessQueryRequest {

    @NotBlank(message = "Query is required")
    private String query;

    private String model;
}
