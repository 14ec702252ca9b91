package com.lucidata.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for result formatting.
 *
 * JSON fields (snake_case):
 * - data: rows to format
 * - format: html (default), csv or json
 * - visualization_type: optional chart type (bar, line, pie)
 * - title, description: optional captions
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FormatRequest {
    private List<Map<String, Object>> data;
    private String format = "html";
    private String visualizationType;
    private String title;
    private String description;
}
