package com.lucidata.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for natural-language to SQL translation.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProcessQueryResponse {

    private String sqlQuery;

    /**
     * Null when the model gave none.
     */
    private String explanation;

    private Double confidence;

    /**
     * Fallback notices, empty when the translation needed none.
     */
    private List<String> warnings;
}
