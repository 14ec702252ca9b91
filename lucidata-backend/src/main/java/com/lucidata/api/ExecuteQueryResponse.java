package com.lucidata.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.lucidata.model.ExecutionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecuteQueryResponse {
    private List<Map<String, Object>> results;
    private Metadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Metadata {
        private long rowCount;
        private List<String> columnNames;
        private long queryExecutionTimeMs;
    }

    public static ExecuteQueryResponse from(ExecutionResult result) {
        return ExecuteQueryResponse.builder()
                .results(result.rows())
                .metadata(Metadata.builder()
                        .rowCount(result.rowCount())
                        .columnNames(result.columnNames())
                        .queryExecutionTimeMs(result.durationMs())
                        .build())
                .build();
    }
}
