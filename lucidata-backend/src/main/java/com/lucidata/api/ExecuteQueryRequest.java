package com.lucidata.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecuteQueryRequest {

    @NotBlank(message = "Query is required")
    private String query;

    /**
     * Values for {@code :name} placeholders in {@link #query}.
     */
    private Map<String, Object> params;
}
