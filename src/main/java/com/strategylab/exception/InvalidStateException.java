package com.strategylab.exception;

import java.util.Map;

/**
 * Thrown when an operation is not allowed in the current lifecycle state of a
 * resource, e.g. cancelling a batch job that has already finished or failed.
 */
public class InvalidStateException extends BaseException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public InvalidStateException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_STATE, message, details);
    }
}
