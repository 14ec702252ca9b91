package com.lucidata.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the combined translate-then-execute route.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TranslateAndExecuteResponse {
    private String naturalQuery;
    private String sqlQuery;
    private List<Map<String, Object>> results;
    private String explanation;
    private List<String> warnings;
    private Metadata metadata;

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Metadata {
        private double confidence;
        private long executionTimeMs;
        private long llmProcessingTimeMs;
        private long totalTimeMs;
    }
}
