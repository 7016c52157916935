package com.strategylab.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/** Machine-readable error codes. The enum name is the {@code error.code} clients see. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_STATE(HttpStatus.CONFLICT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    EVALUATOR_ERROR(HttpStatus.BAD_GATEWAY);

    private final HttpStatus httpStatus;

    public String getCode() {
        return name();
    }

    public boolean isServerError() {
        return httpStatus.is5xxServerError();
    }
}
