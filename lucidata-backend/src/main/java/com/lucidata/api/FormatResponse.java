package com.lucidata.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FormatResponse {
    private String formattedData;

    /**
     * PNG chart as a data URI, or null.
     */
    private String visualization;

    private String contentType;
}
