package com.strategylab.api.dto.response;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import lombok.Value;

/** Success envelope: {@code {success: true, data, timestamp}}. */
@Value
@JsonPropertyOrder({"success", "data", "timestamp"})
public class ApiResponse<T> {

    boolean success;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
