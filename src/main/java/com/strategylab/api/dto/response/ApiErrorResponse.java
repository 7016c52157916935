package com.strategylab.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.strategylab.exception.BaseException;
import com.strategylab.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Error envelope: {@code {success: false, error: {code, message, details, timestamp, path}}}.
 * {@code details} is left out when there are none.
 */
@Value
@JsonPropertyOrder({"success", "error"})
public class ApiErrorResponse {

    boolean success;
    ErrorBody error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(false, ErrorBody.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    public static ApiErrorResponse of(BaseException exception, String path) {
        return of(exception.getErrorCode(), exception.getMessage(), exception.getDetails(), path);
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class ErrorBody {
        String code;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
