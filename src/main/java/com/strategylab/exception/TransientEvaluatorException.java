package com.strategylab.exception;

/**
 * Evaluator failure that may succeed on a later attempt: the service was unreachable,
 * timed out or answered with a 5xx status. Only this type is retried.
 */
public class TransientEvaluatorException extends EvaluatorException {

    public TransientEvaluatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
