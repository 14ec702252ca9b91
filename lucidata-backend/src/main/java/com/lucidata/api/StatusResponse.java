package com.lucidata.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Liveness body; {@code message} is omitted when null.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResponse {
    private String status;
    private String message;

    public static StatusResponse ok() {
        return new StatusResponse("ok", null);
    }
}
