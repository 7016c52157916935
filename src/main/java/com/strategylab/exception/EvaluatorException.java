package com.strategylab.exception;

/**
 * Failure of the external single-run backtest evaluator for one assignment.
 *
 * <p>The orchestrator records the message against the failed run and keeps going;
 * it never reaches a REST caller.
 */
public class EvaluatorException extends BaseException {

    public EvaluatorException(String message) {
        super(ErrorCode.EVALUATOR_ERROR, message);
    }

    public EvaluatorException(String message, Throwable cause) {
        super(ErrorCode.EVALUATOR_ERROR, message, cause);
    }
}
