package com.strategylab.variable;

/** How a bound value is coerced when it replaces a token in a given field. */
public enum FieldKind {
    /** Symbol fields; values are upper-cased. */
    TICKER,
    /** Weights, periods, thresholds, counts; values must parse as a decimal. */
    NUMBER,
    /** Names and free-form parameters; values are used verbatim. */
    TEXT
}
