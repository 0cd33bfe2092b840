package com.claimstrategy.common.exception;

/** Raised when a probability-like input falls outside {@code [0, 1]}. */
public class InvalidProbabilityException extends StrategyEngineException {

    public InvalidProbabilityException(String field, double value) {
        super("Validation", field + " must lie in [0, 1] but was " + value);
    }
}
